package com.questrail.meshgate.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Listening side of a line-oriented, connection-based transport.
 *
 * <p>The endpoint only accepts connections, splits inbound bytes into lines and
 * writes lines back. Chat protocol meaning lives in the {@code irc} package.</p>
 */
public interface LineEndpoint
{
    /**
     * Bind and begin accepting connections.
     *
     * @throws IllegalStateException if the listen address cannot be bound
     */
    void start();

    /**
     * Close the listening socket and every accepted connection.
     */
    void stop();

    /**
     * Register the listener that receives connection lifecycle events and lines.
     * Must be called before {@link #start()}.
     */
    void setListener(LineEndpointListener listener);

    /**
     * The bound local address once started.
     */
    Optional<SocketAddress> boundAddress();
}
