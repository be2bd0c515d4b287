package com.questrail.meshgate.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FakeClientConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link ClientConnection} that records every line written to it.
 */
public final class FakeClientConnection implements ClientConnection {

    private final String id;
    private final String remoteHost;
    private final List<String> sent = new ArrayList<>();
    private boolean open = true;

    public FakeClientConnection(String id) {
        this(id, "127.0.0.1");
    }

    public FakeClientConnection(String id, String remoteHost) {
        this.id = Objects.requireNonNull(id, "id");
        this.remoteHost = Objects.requireNonNull(remoteHost, "remoteHost");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String remoteHost() {
        return remoteHost;
    }

    @Override
    public synchronized void sendLine(String line) {
        if (open) {
            sent.add(line);
        }
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized List<String> sent() {
        return new ArrayList<>(sent);
    }

    /** Lines containing {@code fragment}. */
    public synchronized List<String> sentContaining(String fragment) {
        return sent.stream().filter(l -> l.contains(fragment)).collect(Collectors.toList());
    }

    /** Text of every NOTICE line, in order. */
    public synchronized List<String> notices() {
        return sent.stream()
            .filter(l -> l.contains(" NOTICE "))
            .map(l -> l.substring(l.indexOf(" :", l.indexOf(" NOTICE ")) + 2))
            .collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }
}
