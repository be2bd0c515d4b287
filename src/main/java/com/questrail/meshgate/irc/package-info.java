/**
 * Chat side of the gateway.
 *
 * <p>A minimal RFC 1459 server: clients register a nickname, are placed in the
 * single control room, and exchange lines with it. Room lines that start with
 * a command verb are handed to a {@link com.questrail.meshgate.irc.RoomCommandHandler};
 * everything else is relayed to the other members.</p>
 */
package com.questrail.meshgate.irc;
