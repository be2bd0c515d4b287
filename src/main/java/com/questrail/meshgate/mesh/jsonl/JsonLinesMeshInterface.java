package com.questrail.meshgate.mesh.jsonl;

import com.questrail.meshgate.internal.time.Cancellable;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.mesh.MeshEvent;
import com.questrail.meshgate.mesh.MeshEventListener;
import com.questrail.meshgate.mesh.MeshInterface;
import com.questrail.meshgate.mesh.MeshOperationException;
import com.questrail.meshgate.mesh.RequestId;
import com.questrail.meshgate.transport.LineLink;
import com.questrail.meshgate.transport.LineLinkListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JsonLinesMeshInterface
 * =============================================================================
 * Live {@link MeshInterface} backed by a mesh daemon reached over a
 * {@link LineLink}.
 *
 * <pre>
 *   LineLink ──line──▶ MeshJsonCodec.decode ──▶ MeshEvent ──▶ listener
 *   sendText/ping ──▶ MeshJsonCodec.encode ──▶ LineLink.send
 * </pre>
 *
 * <h2>Request identifiers</h2>
 * Synthesized locally and carried in each outbound line; the daemon echoes
 * them in {@code ack}, {@code nak} and {@code pong} lines.
 *
 * <h2>Link loss</h2>
 * A status event is emitted and, while running, a reconnect is attempted every
 * {@link #RECONNECT_DELAY}. Sends while the link is down fail with
 * {@link MeshOperationException}. Lines that cannot be decoded are dropped.
 */
public final class JsonLinesMeshInterface implements MeshInterface, LineLinkListener
{
    private static final Logger log = LoggerFactory.getLogger(JsonLinesMeshInterface.class);

    static final Duration RECONNECT_DELAY = Duration.ofSeconds(5);

    private final LineLink link;
    private final String endpointDescription;
    private final MeshJsonCodec codec;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong nextRequestId = new AtomicLong(1);

    private volatile MeshEventListener listener;
    private volatile Cancellable reconnectTask;

    public JsonLinesMeshInterface(LineLink link,
                                  String endpointDescription,
                                  MeshJsonCodec codec,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler,
                                  WallClock wallClock)
    {
        this.link = Objects.requireNonNull(link, "link");
        this.endpointDescription = Objects.requireNonNull(endpointDescription, "endpointDescription");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.link.setListener(this);
    }

    @Override
    public void setListener(MeshEventListener listener)
    {
        this.listener = listener;
    }

    @Override
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            log.info("Connecting to mesh daemon at {}", endpointDescription);
            link.connect();
        }
    }

    @Override
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Cancellable pending = reconnectTask;
            if (pending != null) {
                pending.cancel();
                reconnectTask = null;
            }
            link.close();
        }
    }

    @Override
    public RequestId sendText(String text, int channelIndex)
    {
        Objects.requireNonNull(text, "text");
        RequestId id = nextId();
        transmit(codec.encodeSendText(id, channelIndex, null, false, text));
        return id;
    }

    @Override
    public RequestId sendDirectText(long destination, String text, boolean wantAck)
    {
        Objects.requireNonNull(text, "text");
        RequestId id = nextId();
        transmit(codec.encodeSendText(id, 0, destination, wantAck, text));
        return id;
    }

    @Override
    public RequestId ping(long destination)
    {
        RequestId id = nextId();
        transmit(codec.encodePing(id, destination));
        return id;
    }

    // -------------------------------------------------------------------------
    // LineLinkListener
    // -------------------------------------------------------------------------

    @Override
    public void onLinkUp()
    {
        log.info("Connected to mesh daemon at {}", endpointDescription);
        emit(new MeshEvent.ConnectionStatus(wallClock.now(), true, "Connected to " + endpointDescription));
    }

    @Override
    public void onLinkDown(Throwable cause)
    {
        String reason = cause == null ? "connection closed" : String.valueOf(cause.getMessage());
        emit(new MeshEvent.ConnectionStatus(wallClock.now(), false, "Disconnected from " + endpointDescription + " (" + reason + ")"));
        if (!running.get()) {
            return;
        }
        log.warn("Mesh daemon link down ({}); reconnecting in {}s", reason, RECONNECT_DELAY.toSeconds());
        reconnectTask = scheduler.scheduleAfter(RECONNECT_DELAY, clock, () -> {
            if (running.get()) {
                link.connect();
            }
        });
    }

    @Override
    public void onLine(String line)
    {
        if (line.isBlank()) {
            return;
        }
        final Optional<MeshEvent> event;
        try {
            event = codec.decode(line, wallClock.now());
        }
        catch (MeshCodecException e) {
            log.warn("Dropping undecodable line from mesh daemon: {}", e.getMessage());
            return;
        }
        if (event.isEmpty()) {
            log.debug("Ignoring mesh daemon line of unknown type: {}", line);
            return;
        }
        emit(event.get());
    }

    private void transmit(String line)
    {
        if (!running.get() || !link.send(line)) {
            throw new MeshOperationException("Mesh interface is not connected");
        }
    }

    private RequestId nextId()
    {
        return RequestId.of(nextRequestId.getAndIncrement());
    }

    private void emit(MeshEvent event)
    {
        MeshEventListener l = listener;
        if (l != null) {
            l.onMeshEvent(event);
        }
    }
}
