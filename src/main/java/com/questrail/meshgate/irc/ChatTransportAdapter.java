package com.questrail.meshgate.irc;

import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.observability.BridgeErrorEvent;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import com.questrail.meshgate.transport.ClientConnection;
import com.questrail.meshgate.transport.LineEndpoint;
import com.questrail.meshgate.transport.LineEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ChatTransportAdapter
 * =============================================================================
 * Binds a {@link LineEndpoint} to the {@link ChatServer}.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   LineEndpoint
 *        → onConnectionOpened → ChatServer.acceptConnection
 *        → onLine             → ChatServer.handleLine
 *        → onConnectionClosed → ChatServer.disconnect
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class does not parse lines or decide replies. A failure while handling
 * one line is reported and the connection stays up.
 */
public final class ChatTransportAdapter implements LineEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(ChatTransportAdapter.class);

    private final ChatServer server;
    private final LineEndpoint endpoint;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;

    private final ConcurrentMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

    public ChatTransportAdapter(ChatServer server,
                                LineEndpoint endpoint,
                                WallClock wallClock,
                                BridgeObservabilitySink sink)
    {
        this.server = Objects.requireNonNull(server, "server");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.endpoint.setListener(this);
    }

    public void start()
    {
        endpoint.start();
    }

    public void stop()
    {
        endpoint.stop();
    }

    // -------------------------------------------------------------------------
    // LineEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnectionOpened(ClientConnection connection)
    {
        sessions.put(connection.id(), server.acceptConnection(connection));
    }

    @Override
    public void onLine(ClientConnection connection, String line)
    {
        ClientSession session = sessions.get(connection.id());
        if (session == null) {
            log.debug("Line for unknown connection {} dropped", connection.id());
            return;
        }
        try {
            server.handleLine(session, line);
        }
        catch (RuntimeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(),
                    "Failed to handle line from " + connection.id() + ": " + e.getMessage(), e));
        }
    }

    @Override
    public void onConnectionClosed(ClientConnection connection, Throwable cause)
    {
        ClientSession session = sessions.remove(connection.id());
        if (session == null) {
            return;
        }
        String reason = cause == null
                ? "Connection closed"
                : "Connection error: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        server.disconnect(session, reason);
    }
}
