package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.CommandFixture;
import com.questrail.meshgate.correlation.RequestKind;
import com.questrail.meshgate.directory.NodeUpdate;
import com.questrail.meshgate.mesh.MeshOperationException;
import com.questrail.meshgate.mesh.RecordingMeshInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeshCommandsTest
 * -----------------------------------------------------------------------------
 * SEND, ALARM, DM and PING against a recording mesh interface.
 */
class MeshCommandsTest {

    private static final long MK1 = 0xA1B2C301L;

    private CommandFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CommandFixture();
        fixture.directory.upsert(MK1, NodeUpdate.builder()
                .shortName("MK1").longName("Mock Node 1").heardAt(Instant.parse("2024-05-11T11:59:00Z")).build());
    }

    @Test
    void sendBroadcastsOnTheDefaultChannel() {
        List<String> replies = fixture.run("SEND hello mesh");

        assertEquals(List.of("Sending 'hello mesh' to mesh channel 0...", "Message sent to mesh channel 0."), replies);
        RecordingMeshInterface.Sent sent = fixture.mesh.last();
        assertEquals("text", sent.kind());
        assertEquals("hello mesh", sent.text());
        assertEquals(0, sent.channel());
        assertEquals(0, fixture.correlator.pendingCount());
    }

    @Test
    void sendWithoutTextShowsUsage() {
        assertEquals(List.of("Usage: SEND <message> - Sends message to default mesh channel"), fixture.run("SEND"));
        assertTrue(fixture.mesh.sent().isEmpty());
    }

    @Test
    void sendEnforcesTheLengthLimit() {
        assertEquals(2, fixture.run("SEND " + "x".repeat(240)).size());
        assertEquals(1, fixture.mesh.sent().size());

        List<String> replies = fixture.run("SEND " + "x".repeat(241));

        assertEquals(List.of("Error: Message too long (241 chars). Maximum is 240 characters."), replies);
        assertEquals(1, fixture.mesh.sent().size());
    }

    @Test
    void sendReportsMeshFailure() {
        fixture.mesh.failWith(new MeshOperationException("Mesh interface is not connected"));

        List<String> replies = fixture.run("SEND hi");

        assertEquals(List.of("Sending 'hi' to mesh channel 0...",
                "Meshtastic Error sending message: Mesh interface is not connected"), replies);
    }

    @Test
    void alarmPrefixesTheMarker() {
        List<String> replies = fixture.run("ALARM  smoke at the north gate ");

        assertEquals(List.of("Broadcasting Alarm to mesh channel 0: 'smoke at the north gate'...",
                "Alarm message sent to mesh channel 0."), replies);
        assertEquals("ALARM: smoke at the north gate", fixture.mesh.last().text());
    }

    @Test
    void alarmHasAShorterLimit() {
        List<String> replies = fixture.run("ALARM " + "y".repeat(231));

        assertEquals(List.of("Error: Alarm message too long (231 chars). Maximum is 230 characters."), replies);
        assertTrue(fixture.mesh.sent().isEmpty());
    }

    @Test
    void directMessageIsTrackedForTheRequester() {
        List<String> replies = fixture.run("DM mk1 are you there?");

        assertEquals(List.of("Sending DM 'are you there?' to Mock Node 1 (!a1b2c301)...",
                "DM request sent to Mock Node 1. Waiting for ACK/NAK..."), replies);
        RecordingMeshInterface.Sent sent = fixture.mesh.last();
        assertEquals("direct", sent.kind());
        assertEquals(MK1, sent.destination());
        assertTrue(sent.wantAck());
        assertEquals(RequestKind.DIRECT_MESSAGE,
                fixture.correlator.find(sent.id()).orElseThrow().kind());
        assertEquals("alice", fixture.correlator.find(sent.id()).orElseThrow().requester());
    }

    @Test
    void directMessageKeepsQuotesInTheText() {
        fixture.run("DM \"Mock Node 1\" don't \"panic\"");

        assertEquals("don't \"panic\"", fixture.mesh.last().text());
    }

    @Test
    void directMessageToUnknownNodeSendsNothing() {
        List<String> replies = fixture.run("DM ghost hello");

        assertEquals(List.of("Error: Could not find node matching 'ghost'. Use NODES command."), replies);
        assertTrue(fixture.mesh.sent().isEmpty());
        assertEquals(0, fixture.correlator.pendingCount());
    }

    @Test
    void directMessageWithoutTextShowsUsage() {
        assertEquals(List.of("Usage: DM <node_id|shortname|nodenum> <message> - Sends direct message to a node"),
                fixture.run("DM MK1"));
    }

    @Test
    void directMessageFailureLeavesNothingPending() {
        fixture.mesh.failWith(new MeshOperationException("Mesh interface is not connected"));

        List<String> replies = fixture.run("DM MK1 hello");

        assertEquals("Meshtastic Error sending DM: Mesh interface is not connected", replies.get(1));
        assertEquals(0, fixture.correlator.pendingCount());
    }

    @Test
    void pingToUnknownNodeSendsNothing() {
        List<String> replies = fixture.run("PING ghost");

        assertEquals(List.of("Error: Could not find node matching 'ghost'."), replies);
        assertTrue(fixture.mesh.sent().isEmpty());
        assertEquals(0, fixture.correlator.pendingCount());
    }

    @Test
    void pingByNodeIdIsTracked() {
        List<String> replies = fixture.run("PING !a1b2c301");

        assertEquals(List.of("Sending Meshtastic Ping to Mock Node 1 (!a1b2c301)...",
                "Ping request sent to Mock Node 1. Waiting for reply (PONG)..."), replies);
        assertEquals("ping", fixture.mesh.last().kind());
        assertEquals(RequestKind.PING, fixture.correlator.find(fixture.mesh.last().id()).orElseThrow().kind());
    }

    @Test
    void pingReportsMeshFailure() {
        fixture.mesh.failWith(new MeshOperationException("Node !a1b2c301 is not reachable"));

        List<String> replies = fixture.run("PING MK1");

        assertEquals("Meshtastic Error sending PING: Node !a1b2c301 is not reachable", replies.get(1));
        assertEquals(0, fixture.correlator.pendingCount());
    }
}
