package com.questrail.meshgate.correlation;

import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.mesh.RequestId;
import com.questrail.meshgate.observability.NullObservabilitySink;
import com.questrail.meshgate.time.DeterministicScheduler;
import com.questrail.meshgate.time.ManualMonotonicClock;
import com.questrail.meshgate.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpirySweeperTest
 * -----------------------------------------------------------------------------
 * Periodic sweep driven by the deterministic scheduler.
 */
class ExpirySweeperTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RequestCorrelator correlator;
    private final List<RequesterNotice> delivered = new ArrayList<>();
    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        correlator = new RequestCorrelator(clock, new ManualWallClock(),
                new CorrelationPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1)), NullObservabilitySink.INSTANCE);
        sweeper = new ExpirySweeper(correlator, clock, scheduler, delivered::add);
    }

    @Test
    void expiredRequestIsDeliveredWithinOneSweepInterval() {
        sweeper.start();
        correlator.issue(RequestKind.PING, "alice", MeshNodeRecord.firstSeen(1L), () -> RequestId.of(1));

        for (int i = 0; i < 4; i++) {
            scheduler.advanceAndRun(clock, Duration.ofSeconds(1));
        }
        assertTrue(delivered.isEmpty());

        scheduler.advanceAndRun(clock, Duration.ofSeconds(1));
        assertEquals(1, delivered.size());
        assertEquals("alice", delivered.get(0).nickname());

        scheduler.advanceAndRun(clock, Duration.ofSeconds(1));
        assertEquals(1, delivered.size());
    }

    @Test
    void stopCancelsTheNextSweep() {
        sweeper.start();
        correlator.issue(RequestKind.PING, "alice", MeshNodeRecord.firstSeen(1L), () -> RequestId.of(1));

        sweeper.stop();
        scheduler.advanceAndRun(clock, Duration.ofSeconds(10));

        assertTrue(delivered.isEmpty());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void failingDeliveryDoesNotStopTheSweep() {
        List<String> seen = new ArrayList<>();
        ExpirySweeper failing = new ExpirySweeper(correlator, clock, scheduler, n -> {
            seen.add(n.nickname());
            throw new IllegalStateException("chat gone");
        });
        failing.start();
        correlator.issue(RequestKind.PING, "alice", MeshNodeRecord.firstSeen(1L), () -> RequestId.of(1));
        correlator.issue(RequestKind.PING, "bob", MeshNodeRecord.firstSeen(1L), () -> RequestId.of(2));

        scheduler.advanceAndRun(clock, Duration.ofSeconds(5));

        assertEquals(List.of("alice", "bob"), seen);
        assertEquals(1, scheduler.pendingCount());
    }
}
