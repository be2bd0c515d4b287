package com.questrail.meshgate.relay;

import com.questrail.meshgate.correlation.RequestCorrelator;
import com.questrail.meshgate.correlation.RequestOutcome;
import com.questrail.meshgate.correlation.RequesterNotice;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.directory.NodeDirectory;
import com.questrail.meshgate.directory.NodeUpdate;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.irc.ChatOutput;
import com.questrail.meshgate.mesh.MeshEvent;
import com.questrail.meshgate.mesh.MeshEventListener;
import com.questrail.meshgate.mesh.SignalInfo;
import com.questrail.meshgate.observability.BridgeErrorEvent;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import com.questrail.meshgate.observability.MeshStatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MeshEventRelay
 * =============================================================================
 * Consumes the mesh interface's event stream and turns it into directory
 * updates, request completions and control-room output.
 *
 * <h2>Threading Model</h2>
 * {@link #onMeshEvent} runs on the mesh interface's threads and only offers the
 * event to a bounded queue. A single consumer thread takes events one at a time,
 * so mesh events are applied in arrival order and never concurrently:
 *
 * <pre>
 *   mesh thread(s) ──offer──▶ [bounded queue] ──take──▶ relay thread
 *                                                          ├─▶ NodeDirectory
 *                                                          ├─▶ RequestCorrelator
 *                                                          └─▶ ChatOutput
 * </pre>
 *
 * When the queue is full the new event is dropped and counted. Without a
 * running consumer, {@link #drain()} applies queued events on the caller's
 * thread.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   relay.start()   → starts the consumer thread
 *   relay.stop()    → stops it, leaving unprocessed events queued
 * </pre>
 *
 * <h2>Failure Semantics</h2>
 * An exception while applying one event is reported to the sink and the room;
 * the loop continues with the next event.
 */
public final class MeshEventRelay implements MeshEventListener
{
    private static final Logger log = LoggerFactory.getLogger(MeshEventRelay.class);

    private final NodeDirectory directory;
    private final RequestCorrelator correlator;
    private final ChatOutput chat;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;

    private final BlockingQueue<MeshEvent> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private volatile Thread consumer;

    public MeshEventRelay(NodeDirectory directory,
                          RequestCorrelator correlator,
                          ChatOutput chat,
                          int queueCapacity,
                          WallClock wallClock,
                          BridgeObservabilitySink sink)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.chat = Objects.requireNonNull(chat, "chat");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    /**
     * Starts the consumer thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runLoop, "mesh-event-relay");
            t.setDaemon(true);
            consumer = t;
            t.start();
        }
    }

    /**
     * Stops the consumer thread, waiting up to five seconds for it to exit.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = consumer;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            consumer = null;
        }
    }

    // -------------------------------------------------------------------------
    // MeshEventListener (producer side)
    // -------------------------------------------------------------------------

    @Override
    public void onMeshEvent(MeshEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (!queue.offer(event)) {
            long total = dropped.incrementAndGet();
            log.warn("Mesh event queue full, dropped {} ({} dropped so far)", event, total);
        }
    }

    /**
     * Applies every queued event on the calling thread.
     *
     * @return number of events applied
     */
    public int drain()
    {
        int n = 0;
        MeshEvent event;
        while ((event = queue.poll()) != null) {
            applySafely(event);
            n++;
        }
        return n;
    }

    public int queuedCount()
    {
        return queue.size();
    }

    public long droppedCount()
    {
        return dropped.get();
    }

    // -------------------------------------------------------------------------
    // Consumer side
    // -------------------------------------------------------------------------

    private void runLoop()
    {
        while (running.get()) {
            try {
                MeshEvent event = queue.poll(250, TimeUnit.MILLISECONDS);
                if (event != null) {
                    applySafely(event);
                }
            }
            catch (InterruptedException e) {
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
                return;
            }
        }
    }

    private void applySafely(MeshEvent event)
    {
        try {
            apply(event);
        }
        catch (RuntimeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), "Failed to process " + event, e));
            chat.sendToRoom("[GW ERROR] Error processing mesh event: " + e.getMessage());
        }
    }

    void apply(MeshEvent event)
    {
        log.debug("Mesh event: {}", event);

        if (event instanceof MeshEvent.NodeHeard heard) {
            directory.upsert(heard.nodeNumber(), heard.attributes());
        }
        else if (event instanceof MeshEvent.MessageReceived message) {
            onMessage(message);
        }
        else if (event instanceof MeshEvent.DeliveryAcknowledged ack) {
            notifyRequester(correlator.resolve(ack.requestId(), new RequestOutcome.Acknowledged()));
        }
        else if (event instanceof MeshEvent.DeliveryFailed failed) {
            notifyRequester(correlator.resolve(failed.requestId(),
                    new RequestOutcome.NegativeAcknowledged(failed.reason())));
        }
        else if (event instanceof MeshEvent.PingReply pong) {
            refresh(pong.from(), pong.timestamp(), pong.signal());
            notifyRequester(correlator.resolve(pong.requestId(), new RequestOutcome.Pong(pong.signal())));
        }
        else if (event instanceof MeshEvent.ConnectionStatus status) {
            sink.onMeshStatus(new MeshStatusEvent(status.timestamp(), status.status()));
            chat.sendToRoom("[MESH] Mesh Status: " + status.status());
        }
        else if (event instanceof MeshEvent.LocalNodeReported local) {
            directory.setLocalNodeNumber(local.nodeNumber());
            log.info("Gateway radio is node {}", MeshNodeRecord.defaultNodeId(local.nodeNumber()));
        }
    }

    private void onMessage(MeshEvent.MessageReceived message)
    {
        MeshNodeRecord sender = refresh(message.from(), message.timestamp(), message.signal());
        String prefix = "[MESH Rx ch" + message.channel()
                + " RSSI:" + message.signal().rssiText()
                + " SNR:" + message.signal().snrText() + "]";

        if (message.isBroadcast()) {
            chat.sendToRoom(prefix + " <" + sender.chatName() + "> " + message.text());
            return;
        }

        OptionalLong local = directory.localNodeNumber();
        if (local.isPresent() && local.getAsLong() == message.to()) {
            chat.sendToRoom(prefix + " DM From <" + sender.chatName() + ">: " + message.text());
        }
        else {
            log.debug("Ignoring DM from {} to {}", sender.chatName(), MeshNodeRecord.defaultNodeId(message.to()));
        }
    }

    private MeshNodeRecord refresh(long nodeNumber, Instant heardAt, SignalInfo signal)
    {
        return directory.upsert(nodeNumber, NodeUpdate.builder()
                .heardAt(heardAt)
                .snr(signal.snr())
                .rssi(signal.rssi())
                .build());
    }

    private void notifyRequester(Optional<RequesterNotice> notice)
    {
        notice.ifPresent(n -> chat.sendToSession(n.nickname(), n.line()));
    }
}
