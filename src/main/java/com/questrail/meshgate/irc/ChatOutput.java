package com.questrail.meshgate.irc;

/**
 * Server-originated output primitives the rest of the gateway uses to talk to
 * chat clients.
 */
public interface ChatOutput
{
    /**
     * Posts {@code text} to every member of the control room.
     */
    void sendToRoom(String text);

    /**
     * Sends {@code text} to the session holding {@code nickname}. Does nothing
     * unless that session is currently in the room, e.g. because the client
     * left or disconnected after issuing a request.
     */
    void sendToSession(String nickname, String text);

    /** Number of connected sessions, registered or not. */
    int activeSessionCount();
}
