package com.questrail.meshgate.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * FakeLineEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link LineEndpoint}. Stores no chat semantics; tests inject
 * connection lifecycle events and lines directly.
 */
public final class FakeLineEndpoint implements LineEndpoint {

    private LineEndpointListener listener;
    private boolean started;
    private boolean failOnStart;

    @Override
    public void setListener(LineEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (failOnStart) {
            throw new IllegalStateException("Failed to bind fake endpoint");
        }
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    @Override
    public Optional<SocketAddress> boundAddress() {
        return started ? Optional.of(new InetSocketAddress("127.0.0.1", 6667)) : Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public boolean isStarted() {
        return started;
    }

    public void failOnStart() {
        this.failOnStart = true;
    }

    public FakeClientConnection open(String id) {
        FakeClientConnection connection = new FakeClientConnection(id);
        requireListener().onConnectionOpened(connection);
        return connection;
    }

    public void injectLine(ClientConnection connection, String line) {
        requireListener().onLine(connection, line);
    }

    public void injectClose(ClientConnection connection) {
        requireListener().onConnectionClosed(connection, null);
    }

    private LineEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
