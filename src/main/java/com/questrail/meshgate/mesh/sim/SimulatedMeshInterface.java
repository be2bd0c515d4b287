package com.questrail.meshgate.mesh.sim;

import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.directory.NodeUpdate;
import com.questrail.meshgate.directory.Position;
import com.questrail.meshgate.internal.time.Cancellable;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.mesh.MeshEvent;
import com.questrail.meshgate.mesh.MeshEventListener;
import com.questrail.meshgate.mesh.MeshInterface;
import com.questrail.meshgate.mesh.MeshOperationException;
import com.questrail.meshgate.mesh.RequestId;
import com.questrail.meshgate.mesh.SignalInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SimulatedMeshInterface
 * =============================================================================
 * In-memory mesh used when no radio is attached, and by tests.
 *
 * <h2>Simulated mesh</h2>
 * <ul>
 *   <li>Three nodes on start: the gateway radio {@code GW} (with a GPS fix),
 *       {@code MK1} and {@code MK2}.</li>
 *   <li>A direct message with {@code wantAck} to a known node is acknowledged
 *       after {@link #ACK_DELAY}; to an unknown node it fails with
 *       {@code MAX_RETRANSMIT} after {@link #NAK_DELAY}.</li>
 *   <li>A ping to a known node is answered after {@link #PONG_DELAY}; a ping
 *       to an unknown node is rejected immediately.</li>
 *   <li>{@code MK1} broadcasts every {@link #BROADCAST_INTERVAL}; node
 *       {@code NEW} appears once after {@link #NEW_NODE_DELAY}.</li>
 * </ul>
 *
 * <h2>Timing</h2>
 * All delays run on the supplied {@link MonotonicScheduler}; with a
 * deterministic scheduler a test decides exactly when each event fires.
 */
public final class SimulatedMeshInterface implements MeshInterface
{
    private static final Logger log = LoggerFactory.getLogger(SimulatedMeshInterface.class);

    public static final long GATEWAY_NODE = 12_345_678L;
    public static final long MOCK_NODE_1 = 0xA1B2_C301L;
    public static final long MOCK_NODE_2 = 0xA1B2_C302L;
    public static final long NEW_NODE = 0xA1B2_C303L;

    static final Duration ACK_DELAY = Duration.ofSeconds(2);
    static final Duration NAK_DELAY = Duration.ofSeconds(5);
    static final Duration PONG_DELAY = Duration.ofMillis(1500);
    static final Duration BROADCAST_INTERVAL = Duration.ofSeconds(45);
    static final Duration NEW_NODE_DELAY = Duration.ofSeconds(60);

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong nextRequestId = new AtomicLong(1);
    private final AtomicInteger broadcastCounter = new AtomicInteger();
    private final Set<Long> knownNodes = ConcurrentHashMap.newKeySet();

    private volatile MeshEventListener listener;
    private volatile Cancellable broadcastTask;
    private volatile Cancellable newNodeTask;

    public SimulatedMeshInterface(MonotonicClock clock, MonotonicScheduler scheduler, WallClock wallClock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void setListener(MeshEventListener listener)
    {
        this.listener = listener;
    }

    @Override
    public void start()
    {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Initialized simulated Meshtastic interface");

        Instant now = wallClock.now();
        emit(new MeshEvent.ConnectionStatus(now, true, "Connected (simulator)"));
        emit(new MeshEvent.LocalNodeReported(now, GATEWAY_NODE));
        seed(GATEWAY_NODE, NodeUpdate.builder()
                .shortName("GW").longName("My Gateway Node")
                .heardAt(now).snr(0.0)
                .position(new Position(42.886, -79.249, 180, now))
                .build());
        seed(MOCK_NODE_1, NodeUpdate.builder()
                .shortName("MK1").longName("Mock Node 1")
                .heardAt(now.minusSeconds(60)).snr(10.0)
                .build());
        seed(MOCK_NODE_2, NodeUpdate.builder()
                .shortName("MK2").longName("Mock Node 2")
                .heardAt(now.minusSeconds(120)).snr(-5.5)
                .build());

        broadcastTask = scheduler.scheduleAfter(BROADCAST_INTERVAL, clock, this::simulateBroadcast);
        newNodeTask = scheduler.scheduleAfter(NEW_NODE_DELAY, clock, this::simulateNewNode);
    }

    @Override
    public void stop()
    {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        cancel(broadcastTask);
        cancel(newNodeTask);
        broadcastTask = null;
        newNodeTask = null;
        emit(new MeshEvent.ConnectionStatus(wallClock.now(), false, "Disconnected (simulator stopped)"));
    }

    @Override
    public RequestId sendText(String text, int channelIndex)
    {
        Objects.requireNonNull(text, "text");
        requireRunning();
        RequestId id = nextId();
        log.info("[Simulated mesh] Sending to channel {}: '{}'", channelIndex, text);
        return id;
    }

    @Override
    public RequestId sendDirectText(long destination, String text, boolean wantAck)
    {
        Objects.requireNonNull(text, "text");
        requireRunning();
        RequestId id = nextId();
        log.info("[Simulated mesh] Sending DM '{}' to {} (wantAck={})", text, destination, wantAck);
        if (!wantAck) {
            return id;
        }
        if (knownNodes.contains(destination)) {
            scheduler.scheduleAfter(ACK_DELAY, clock,
                    () -> emitIfRunning(new MeshEvent.DeliveryAcknowledged(wallClock.now(), id)));
        }
        else {
            scheduler.scheduleAfter(NAK_DELAY, clock,
                    () -> emitIfRunning(new MeshEvent.DeliveryFailed(wallClock.now(), id, "MAX_RETRANSMIT")));
        }
        return id;
    }

    @Override
    public RequestId ping(long destination)
    {
        requireRunning();
        if (!knownNodes.contains(destination)) {
            log.warn("[Simulated mesh] Cannot send ping, node {} unknown", destination);
            throw new MeshOperationException("Node " + MeshNodeRecord.defaultNodeId(destination) + " is not reachable");
        }
        RequestId id = nextId();
        log.info("[Simulated mesh] Sending ping to {}", destination);
        scheduler.scheduleAfter(PONG_DELAY, clock,
                () -> emitIfRunning(new MeshEvent.PingReply(wallClock.now(), id, destination, new SignalInfo(9.0, -65))));
        return id;
    }

    private void simulateBroadcast()
    {
        if (!running.get()) {
            return;
        }
        int n = broadcastCounter.incrementAndGet();
        SignalInfo signal = new SignalInfo(8.5 - n * 0.5, -70 + n);
        log.info("[Simulated mesh] Incoming broadcast #{} from MK1", n);
        emit(new MeshEvent.MessageReceived(wallClock.now(), MOCK_NODE_1, BROADCAST, 0,
                "Simulated mesh message #" + n + ".", signal));
        broadcastTask = scheduler.scheduleAfter(BROADCAST_INTERVAL, clock, this::simulateBroadcast);
    }

    private void simulateNewNode()
    {
        if (!running.get()) {
            return;
        }
        log.info("[Simulated mesh] New node appearing: {}", NEW_NODE);
        seed(NEW_NODE, NodeUpdate.builder()
                .shortName("NEW").longName("Newly Seen Node")
                .heardAt(wallClock.now()).snr(5.0)
                .build());
    }

    private void seed(long nodeNumber, NodeUpdate update)
    {
        knownNodes.add(nodeNumber);
        emit(new MeshEvent.NodeHeard(update.heardAt(), nodeNumber, update));
    }

    private void requireRunning()
    {
        if (!running.get()) {
            throw new MeshOperationException("Mesh interface is not connected");
        }
    }

    private RequestId nextId()
    {
        return RequestId.of(nextRequestId.getAndIncrement());
    }

    private void emitIfRunning(MeshEvent event)
    {
        if (running.get()) {
            emit(event);
        }
    }

    private void emit(MeshEvent event)
    {
        MeshEventListener l = listener;
        if (l != null) {
            l.onMeshEvent(event);
        }
    }

    private static void cancel(Cancellable task)
    {
        if (task != null) {
            task.cancel();
        }
    }
}
