package com.questrail.meshgate.transport;

/**
 * LineLink
 * -----------------------------------------------------------------------------
 * Outbound (client side) line-oriented connection, used to reach a mesh daemon.
 */
public interface LineLink
{
    /**
     * Begin connecting. The outcome is reported through the listener.
     */
    void connect();

    /**
     * Close the connection. {@link LineLinkListener#onLinkDown(Throwable)} follows.
     */
    void close();

    /**
     * Send one line.
     *
     * @return {@code false} if the link is not connected and the line was not queued
     */
    boolean send(String line);

    boolean isConnected();

    /**
     * Must be called before {@link #connect()}.
     */
    void setListener(LineLinkListener listener);
}
