package com.questrail.meshgate.mesh.jsonl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshgate.internal.json.Jsons;
import com.questrail.meshgate.mesh.MeshEvent;
import com.questrail.meshgate.mesh.MeshInterface;
import com.questrail.meshgate.mesh.RequestId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeshJsonCodecTest
 * -----------------------------------------------------------------------------
 * Daemon line protocol: outbound operations and inbound event decoding.
 */
class MeshJsonCodecTest {

    private static final Instant NOW = Instant.parse("2024-05-11T12:00:00Z");

    private final MeshJsonCodec codec = new MeshJsonCodec();

    @Test
    void broadcastTextHasNullDestination() throws Exception {
        JsonNode json = Jsons.readTree(codec.encodeSendText(RequestId.of(4), 2, null, false, "hello"));

        assertEquals("sendText", json.get("op").asText());
        assertEquals(4, json.get("id").asLong());
        assertEquals(2, json.get("channel").asInt());
        assertTrue(json.get("to").isNull());
        assertFalse(json.get("wantAck").asBoolean());
        assertEquals("hello", json.get("text").asText());
    }

    @Test
    void directTextCarriesDestinationAndAckFlag() throws Exception {
        JsonNode json = Jsons.readTree(codec.encodeSendText(RequestId.of(5), 0, 0xA1B2C301L, true, "say \"hi\""));

        assertEquals(0xA1B2C301L, json.get("to").asLong());
        assertTrue(json.get("wantAck").asBoolean());
        assertEquals("say \"hi\"", json.get("text").asText());
    }

    @Test
    void pingEncodesDestination() throws Exception {
        JsonNode json = Jsons.readTree(codec.encodePing(RequestId.of(6), 42L));

        assertEquals("ping", json.get("op").asText());
        assertEquals(6, json.get("id").asLong());
        assertEquals(42L, json.get("to").asLong());
    }

    @Test
    void decodesNodeInfoWithPositionAndMetrics() throws Exception {
        String line = "{\"type\":\"nodeInfo\",\"num\":2712847105,\"id\":\"!a1b2c301\",\"shortName\":\"MK1\","
                + "\"longName\":\"Mock Node 1\",\"lastHeard\":1715428800,\"snr\":10.0,\"rssi\":-70,"
                + "\"position\":{\"latitude\":42.886,\"longitude\":-79.249,\"altitude\":180,\"time\":1715428800},"
                + "\"deviceMetrics\":{\"batteryLevel\":87,\"voltage\":4.05,\"uptimeSeconds\":3600}}";

        MeshEvent.NodeHeard heard = (MeshEvent.NodeHeard) codec.decode(line, NOW).orElseThrow();

        assertEquals(0xA1B2C301L, heard.nodeNumber());
        assertEquals("MK1", heard.attributes().shortName());
        assertEquals("Mock Node 1", heard.attributes().longName());
        assertEquals(Instant.ofEpochSecond(1715428800L), heard.attributes().heardAt());
        assertEquals(-70, heard.attributes().rssi());
        assertEquals(180, heard.attributes().position().altitude());
        assertEquals(87, heard.attributes().deviceMetrics().batteryLevel());
        assertNull(heard.attributes().deviceMetrics().channelUtilization());
        assertEquals(3600L, heard.attributes().deviceMetrics().uptimeSeconds());
    }

    @Test
    void nodeInfoWithoutLastHeardUsesReceiveTime() throws Exception {
        MeshEvent.NodeHeard heard = (MeshEvent.NodeHeard) codec.decode("{\"type\":\"nodeInfo\",\"num\":7}", NOW).orElseThrow();

        assertEquals(NOW, heard.attributes().heardAt());
        assertNull(heard.attributes().position());
    }

    @Test
    void decodesBroadcastAndDirectText() throws Exception {
        MeshEvent.MessageReceived broadcast = (MeshEvent.MessageReceived) codec.decode(
                "{\"type\":\"text\",\"from\":1,\"channel\":3,\"text\":\"hi\",\"snr\":5.5}", NOW).orElseThrow();
        assertEquals(MeshInterface.BROADCAST, broadcast.to());
        assertEquals(3, broadcast.channel());
        assertEquals(5.5, broadcast.signal().snr());
        assertNull(broadcast.signal().rssi());

        MeshEvent.MessageReceived direct = (MeshEvent.MessageReceived) codec.decode(
                "{\"type\":\"text\",\"from\":1,\"to\":12345678,\"text\":\"psst\"}", NOW).orElseThrow();
        assertEquals(12_345_678L, direct.to());
        assertEquals(0, direct.channel());
        assertFalse(direct.isBroadcast());
    }

    @Test
    void decodesOutcomes() throws Exception {
        assertEquals(RequestId.of(9), ((MeshEvent.DeliveryAcknowledged)
                codec.decode("{\"type\":\"ack\",\"id\":9}", NOW).orElseThrow()).requestId());

        MeshEvent.DeliveryFailed nak = (MeshEvent.DeliveryFailed)
                codec.decode("{\"type\":\"nak\",\"id\":10}", NOW).orElseThrow();
        assertEquals("UNKNOWN", nak.reason());

        MeshEvent.PingReply pong = (MeshEvent.PingReply)
                codec.decode("{\"type\":\"pong\",\"id\":11,\"from\":42,\"snr\":9.0,\"rssi\":-65}", NOW).orElseThrow();
        assertEquals(42L, pong.from());
        assertEquals(-65, pong.signal().rssi());
    }

    @Test
    void decodesLocalNodeAndStatus() throws Exception {
        assertEquals(12_345_678L, ((MeshEvent.LocalNodeReported)
                codec.decode("{\"type\":\"myInfo\",\"num\":12345678}", NOW).orElseThrow()).nodeNumber());

        MeshEvent.ConnectionStatus status = (MeshEvent.ConnectionStatus)
                codec.decode("{\"type\":\"status\",\"connected\":true,\"status\":\"radio ready\"}", NOW).orElseThrow();
        assertTrue(status.connected());
        assertEquals("radio ready", status.status());
    }

    @Test
    void unknownTypeIsIgnored() throws Exception {
        assertTrue(codec.decode("{\"type\":\"telemetry\",\"x\":1}", NOW).isEmpty());
    }

    @Test
    void malformedLinesAreRejected() {
        assertThrows(MeshCodecException.class, () -> codec.decode("not json", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("[1,2]", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("{\"num\":1}", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("{\"type\":\"ack\"}", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("{\"type\":\"text\",\"from\":1}", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("{\"type\":\"myInfo\",\"num\":4294967296}", NOW));
        assertThrows(MeshCodecException.class, () -> codec.decode("{\"type\":\"myInfo\",\"num\":-1}", NOW));
    }

    @Test
    void outOfRangeTimestampsAreRejected() {
        MeshCodecException heard = assertThrows(MeshCodecException.class, () -> codec.decode(
                "{\"type\":\"nodeInfo\",\"num\":1,\"lastHeard\":99999999999999999}", NOW));
        assertTrue(heard.getMessage().contains("lastHeard"));

        MeshCodecException fix = assertThrows(MeshCodecException.class, () -> codec.decode(
                "{\"type\":\"nodeInfo\",\"num\":1,"
                        + "\"position\":{\"latitude\":42.0,\"longitude\":-79.0,\"time\":-99999999999999999}}", NOW));
        assertTrue(fix.getMessage().contains("time"));
    }

    @Test
    void invalidPositionIsRejected() {
        MeshCodecException e = assertThrows(MeshCodecException.class, () -> codec.decode(
                "{\"type\":\"nodeInfo\",\"num\":7,\"position\":{\"latitude\":123.0,\"longitude\":0.0}}", NOW));
        assertTrue(e.getMessage().startsWith("Invalid position for node 7"));
    }
}
