package com.questrail.meshgate.directory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NodeResolverTest
 * -----------------------------------------------------------------------------
 * Reference lookup order and tie-breaking.
 */
class NodeResolverTest {

    private static final Instant T0 = Instant.parse("2024-05-11T12:00:00Z");

    private NodeDirectory directory;
    private NodeResolver resolver;

    @BeforeEach
    void setUp() {
        directory = new NodeDirectory();
        resolver = new NodeResolver(directory);
        directory.upsert(0xA1B2C301L, NodeUpdate.builder()
                .shortName("MK1").longName("Mock Node 1").heardAt(T0).build());
        directory.upsert(0xA1B2C302L, NodeUpdate.builder()
                .shortName("MK2").longName("Mock Node 2").heardAt(T0.minusSeconds(60)).build());
    }

    @Test
    void resolvesByNodeId() {
        assertEquals(0xA1B2C302L, resolver.resolve("!a1b2c302").orElseThrow().nodeNumber());
    }

    @Test
    void resolvesByShortNameIgnoringCase() {
        assertEquals(0xA1B2C301L, resolver.resolve("mk1").orElseThrow().nodeNumber());
    }

    @Test
    void resolvesByLongNameIgnoringCase() {
        assertEquals(0xA1B2C302L, resolver.resolve("mock node 2").orElseThrow().nodeNumber());
    }

    @Test
    void resolvesByDecimalNodeNumber() {
        assertEquals(0xA1B2C301L, resolver.resolve(Long.toString(0xA1B2C301L)).orElseThrow().nodeNumber());
    }

    @Test
    void unknownReferenceResolvesToNothing() {
        assertTrue(resolver.resolve("ghost").isEmpty());
        assertTrue(resolver.resolve("   ").isEmpty());
        assertTrue(resolver.resolve("99999999999").isEmpty());
    }

    @Test
    void earlierStepWinsOverLaterStep() {
        // short name of one node equals the decimal number of another
        directory.upsert(100L, NodeUpdate.builder().shortName("200").heardAt(T0).build());
        directory.upsert(200L, NodeUpdate.heard(T0));

        assertEquals(100L, resolver.resolve("200").orElseThrow().nodeNumber());
    }

    @Test
    void sharedShortNameResolvesToMostRecentlyHeard() {
        directory.upsert(1L, NodeUpdate.builder().shortName("DUP").heardAt(T0.minusSeconds(300)).build());
        directory.upsert(2L, NodeUpdate.builder().shortName("DUP").heardAt(T0).build());
        directory.upsert(3L, NodeUpdate.builder().shortName("DUP").build());

        assertEquals(2L, resolver.resolve("dup").orElseThrow().nodeNumber());
    }

    @Test
    void neverHeardTiesGoToLowestNodeNumber() {
        directory.upsert(9L, NodeUpdate.builder().shortName("TIE").build());
        directory.upsert(8L, NodeUpdate.builder().shortName("TIE").build());

        assertEquals(8L, resolver.resolve("TIE").orElseThrow().nodeNumber());
    }
}
