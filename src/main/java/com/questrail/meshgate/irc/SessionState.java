package com.questrail.meshgate.irc;

/**
 * Registration state of a chat session.
 *
 * <pre>
 *   UNREGISTERED → REGISTERED_NOT_IN_ROOM ⇄ REGISTERED_IN_ROOM
 *        ↘               ↓                     ↙
 *                     DISCONNECTED
 * </pre>
 *
 * No transition leads back to {@link #UNREGISTERED}.
 */
public enum SessionState
{
    UNREGISTERED,
    REGISTERED_NOT_IN_ROOM,
    REGISTERED_IN_ROOM,
    DISCONNECTED;

    public boolean isRegistered()
    {
        return this == REGISTERED_NOT_IN_ROOM || this == REGISTERED_IN_ROOM;
    }
}
