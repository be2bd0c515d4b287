package com.questrail.meshgate.transport;

/**
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>Callbacks for one connection are delivered in order and never
 * concurrently. Callbacks for different connections may run in parallel.</p>
 */
public interface LineEndpointListener
{
    void onConnectionOpened(ClientConnection connection);

    /**
     * One complete inbound line, terminator stripped.
     */
    void onLine(ClientConnection connection, String line);

    /**
     * The connection is gone.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onConnectionClosed(ClientConnection connection, Throwable cause);
}
