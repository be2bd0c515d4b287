package com.questrail.meshgate.directory;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NodeDirectoryTest
 * -----------------------------------------------------------------------------
 * Upsert merge semantics and the local-node marker.
 */
class NodeDirectoryTest {

    private static final Instant T0 = Instant.parse("2024-05-11T12:00:00Z");

    private final NodeDirectory directory = new NodeDirectory();

    @Test
    void firstUpsertCreatesRecordWithDefaultId() {
        MeshNodeRecord record = directory.upsert(12_345_678L, NodeUpdate.heard(T0));

        assertEquals("!00bc614e", record.nodeId());
        assertEquals(T0, record.lastHeard());
        assertNull(record.shortName());
        assertEquals(1, directory.size());
    }

    @Test
    void laterUpdatesKeepFieldsTheyDoNotCarry() {
        directory.upsert(7L, NodeUpdate.builder().shortName("ABC").longName("Alpha Bravo").snr(4.5).heardAt(T0).build());
        directory.upsert(7L, NodeUpdate.builder().rssi(-80).heardAt(T0.plusSeconds(30)).build());

        MeshNodeRecord record = directory.lookup(7L).orElseThrow();
        assertEquals("ABC", record.shortName());
        assertEquals("Alpha Bravo", record.longName());
        assertEquals(4.5, record.snr());
        assertEquals(-80, record.rssi());
        assertEquals(T0.plusSeconds(30), record.lastHeard());
    }

    @Test
    void renameReplacesTheName() {
        directory.upsert(7L, NodeUpdate.builder().shortName("OLD").build());
        directory.upsert(7L, NodeUpdate.builder().shortName("NEW").build());

        assertEquals("NEW", directory.lookup(7L).orElseThrow().shortName());
    }

    @Test
    void lookupOfUnknownNodeIsEmpty() {
        assertTrue(directory.lookup(99L).isEmpty());
    }

    @Test
    void localNodeIsTrackedEvenBeforeItIsHeard() {
        assertTrue(directory.localNode().isEmpty());

        directory.setLocalNodeNumber(42L);

        assertEquals(42L, directory.localNodeNumber().getAsLong());
        assertEquals("!0000002a", directory.localNode().orElseThrow().nodeId());
    }

    @Test
    void snapshotIsDetachedFromLaterUpdates() {
        directory.upsert(1L, NodeUpdate.heard(T0));
        List<MeshNodeRecord> snapshot = directory.all();

        directory.upsert(2L, NodeUpdate.heard(T0));

        assertEquals(1, snapshot.size());
        assertEquals(2, directory.all().size());
    }

    @Test
    void concurrentUpdatesToOneNodeLoseNoFields() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Runnable> writers = new ArrayList<>();
        writers.add(() -> directory.upsert(5L, NodeUpdate.builder().shortName("S").build()));
        writers.add(() -> directory.upsert(5L, NodeUpdate.builder().longName("Long").build()));
        writers.add(() -> directory.upsert(5L, NodeUpdate.builder().snr(1.0).build()));
        writers.add(() -> directory.upsert(5L, NodeUpdate.builder().rssi(-50).build()));
        for (Runnable w : writers) {
            pool.submit(() -> {
                go.await();
                w.run();
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        MeshNodeRecord record = directory.lookup(5L).orElseThrow();
        assertEquals("S", record.shortName());
        assertEquals("Long", record.longName());
        assertEquals(1.0, record.snr());
        assertEquals(-50, record.rssi());
    }

    @Test
    void namesFallBackToTheNodeId() {
        MeshNodeRecord bare = MeshNodeRecord.firstSeen(0xA1B2C301L);
        MeshNodeRecord shortOnly = bare.merge(NodeUpdate.builder().shortName("MK1").build());
        MeshNodeRecord both = shortOnly.merge(NodeUpdate.builder().longName("Mock Node 1").build());

        assertEquals("!a1b2c301", bare.displayName());
        assertEquals("!a1b2c301", bare.chatName());
        assertEquals("MK1", shortOnly.displayName());
        assertEquals("Mock Node 1", both.displayName());
        assertEquals("MK1", both.chatName());
    }

    @Test
    void nodeNumbersOutsideTheUnsigned32BitRangeAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MeshNodeRecord.firstSeen(-1L));
        assertThrows(IllegalArgumentException.class, () -> MeshNodeRecord.firstSeen(0x1_0000_0000L));
    }
}
