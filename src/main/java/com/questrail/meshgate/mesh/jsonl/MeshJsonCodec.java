package com.questrail.meshgate.mesh.jsonl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.meshgate.directory.DeviceMetrics;
import com.questrail.meshgate.directory.NodeUpdate;
import com.questrail.meshgate.directory.Position;
import com.questrail.meshgate.internal.json.Jsons;
import com.questrail.meshgate.mesh.MeshEvent;
import com.questrail.meshgate.mesh.MeshInterface;
import com.questrail.meshgate.mesh.RequestId;
import com.questrail.meshgate.mesh.SignalInfo;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * MeshJsonCodec
 * =============================================================================
 * Newline-delimited JSON spoken with the mesh daemon.
 *
 * <h2>Outbound</h2>
 * <pre>
 *   {"op":"sendText","id":7,"channel":0,"to":null,"wantAck":false,"text":"hi"}
 *   {"op":"ping","id":8,"to":2712847105}
 * </pre>
 *
 * <h2>Inbound</h2>
 * One object per line, discriminated by {@code type}:
 * {@code nodeInfo}, {@code text}, {@code ack}, {@code nak}, {@code pong},
 * {@code myInfo}, {@code status}. Node numbers are unsigned 32-bit integers;
 * times are epoch seconds.
 *
 * <p>Decoding is all-or-nothing: a line either yields a complete event or is
 * rejected.</p>
 */
public final class MeshJsonCodec
{
    public String encodeSendText(RequestId id, int channel, Long destination, boolean wantAck, String text)
    {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("op", "sendText");
        node.put("id", id.value());
        node.put("channel", channel);
        if (destination == null) {
            node.putNull("to");
        }
        else {
            node.put("to", destination.longValue());
        }
        node.put("wantAck", wantAck);
        node.put("text", text);
        return Jsons.toJson(node);
    }

    public String encodePing(RequestId id, long destination)
    {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("op", "ping");
        node.put("id", id.value());
        node.put("to", destination);
        return Jsons.toJson(node);
    }

    /**
     * @param receivedAt timestamp given to the decoded event
     * @return the event, or empty for a well-formed line of a type this
     *         gateway does not use
     * @throws MeshCodecException if the line is not JSON or lacks a required field
     */
    public Optional<MeshEvent> decode(String line, Instant receivedAt)
    {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(receivedAt, "receivedAt");

        JsonNode root;
        try {
            root = Jsons.readTree(line);
        }
        catch (JsonProcessingException e) {
            throw new MeshCodecException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MeshCodecException("Expected a JSON object");
        }

        String type = requiredText(root, "type");
        switch (type) {
            case "nodeInfo":
                return Optional.of(decodeNodeInfo(root, receivedAt));
            case "text":
                return Optional.of(new MeshEvent.MessageReceived(
                        receivedAt,
                        nodeNumber(root, "from"),
                        root.hasNonNull("to") ? nodeNumber(root, "to") : MeshInterface.BROADCAST,
                        root.path("channel").asInt(0),
                        requiredText(root, "text"),
                        signal(root)));
            case "ack":
                return Optional.of(new MeshEvent.DeliveryAcknowledged(receivedAt, requestId(root)));
            case "nak":
                return Optional.of(new MeshEvent.DeliveryFailed(receivedAt, requestId(root),
                        root.path("reason").asText("UNKNOWN")));
            case "pong":
                return Optional.of(new MeshEvent.PingReply(receivedAt, requestId(root),
                        nodeNumber(root, "from"), signal(root)));
            case "myInfo":
                return Optional.of(new MeshEvent.LocalNodeReported(receivedAt, nodeNumber(root, "num")));
            case "status":
                return Optional.of(new MeshEvent.ConnectionStatus(receivedAt,
                        root.path("connected").asBoolean(false),
                        requiredText(root, "status")));
            default:
                return Optional.empty();
        }
    }

    private static MeshEvent decodeNodeInfo(JsonNode root, Instant receivedAt)
    {
        long num = nodeNumber(root, "num");
        NodeUpdate.Builder update = NodeUpdate.builder()
                .nodeId(optionalText(root, "id"))
                .shortName(optionalText(root, "shortName"))
                .longName(optionalText(root, "longName"))
                .heardAt(root.hasNonNull("lastHeard") ? epochSeconds(root, "lastHeard") : receivedAt)
                .snr(optionalDouble(root, "snr"))
                .rssi(optionalInt(root, "rssi"));

        JsonNode position = root.path("position");
        if (position.hasNonNull("latitude") && position.hasNonNull("longitude")) {
            try {
                update.position(new Position(
                        position.get("latitude").asDouble(),
                        position.get("longitude").asDouble(),
                        optionalInt(position, "altitude"),
                        position.hasNonNull("time") ? epochSeconds(position, "time") : null));
            }
            catch (IllegalArgumentException e) {
                throw new MeshCodecException("Invalid position for node " + num + ": " + e.getMessage(), e);
            }
        }

        JsonNode metrics = root.path("deviceMetrics");
        if (metrics.isObject()) {
            update.deviceMetrics(new DeviceMetrics(
                    optionalInt(metrics, "batteryLevel"),
                    optionalDouble(metrics, "voltage"),
                    optionalDouble(metrics, "channelUtilization"),
                    optionalDouble(metrics, "airUtilTx"),
                    metrics.hasNonNull("uptimeSeconds") ? metrics.get("uptimeSeconds").asLong() : null));
        }
        return new MeshEvent.NodeHeard(receivedAt, num, update.build());
    }

    private static SignalInfo signal(JsonNode root)
    {
        return new SignalInfo(optionalDouble(root, "snr"), optionalInt(root, "rssi"));
    }

    private static RequestId requestId(JsonNode root)
    {
        JsonNode id = root.get("id");
        if (id == null || !id.canConvertToLong()) {
            throw new MeshCodecException("Missing numeric field 'id'");
        }
        return RequestId.of(id.asLong());
    }

    private static long nodeNumber(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new MeshCodecException("Missing numeric field '" + field + "'");
        }
        long n = value.asLong();
        if (n < 0 || n > 0xFFFF_FFFFL) {
            throw new MeshCodecException("Field '" + field + "' out of node number range: " + n);
        }
        return n;
    }

    private static Instant epochSeconds(JsonNode root, String field)
    {
        long seconds = root.get(field).asLong();
        try {
            return Instant.ofEpochSecond(seconds);
        }
        catch (DateTimeException e) {
            throw new MeshCodecException("Field '" + field + "' out of timestamp range: " + seconds, e);
        }
    }

    private static String requiredText(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw new MeshCodecException("Missing text field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Double optionalDouble(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static Integer optionalInt(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }
}
