package com.questrail.meshgate.transport;

/**
 * ClientConnection
 * -----------------------------------------------------------------------------
 * Handle for one accepted chat client connection.
 *
 * <p>The chat session that owns a connection is the only writer to it. Writes
 * are line-oriented: implementations append the protocol line terminator.</p>
 */
public interface ClientConnection
{
    /**
     * Stable identifier for logs and maps; unique for the process lifetime.
     */
    String id();

    /**
     * Host part of the remote address, used in chat prefixes ({@code nick!user@host}).
     */
    String remoteHost();

    /**
     * Queue one line for delivery. Calls after {@link #close()} are ignored.
     *
     * @param line line without terminator
     */
    void sendLine(String line);

    /**
     * Flush pending lines and close the connection. Idempotent.
     */
    void close();

    boolean isOpen();
}
