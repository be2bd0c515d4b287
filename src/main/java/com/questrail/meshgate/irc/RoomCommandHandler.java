package com.questrail.meshgate.irc;

/**
 * Receives control-room lines whose first word is a command verb.
 *
 * <p>{@link ChatServer} consults {@link #handles(String)} before broadcasting a
 * room message as chat. {@link #handle} is called without any chat server lock
 * held and may block.</p>
 */
public interface RoomCommandHandler
{
    /**
     * @param verb first word of the room message, as typed
     */
    boolean handles(String verb);

    /**
     * @param rawArguments text after the verb, leading whitespace removed
     */
    void handle(String nickname, String verb, String rawArguments);
}
