package com.questrail.meshgate.directory;

import java.time.Instant;
import java.util.Objects;

/**
 * MeshNodeRecord
 * -----------------------------------------------------------------------------
 * Immutable snapshot of everything the gateway knows about one mesh node.
 *
 * <p>{@code nodeNumber} is the only stable key. The ID string and both names
 * are attributes: a node may be renamed at any time and two nodes may share a
 * short name. Every field other than {@code nodeNumber} and {@code nodeId} may
 * be {@code null} when the mesh has not reported it yet.</p>
 */
public record MeshNodeRecord(
        long nodeNumber,
        String nodeId,
        String shortName,
        String longName,
        Instant lastHeard,
        Double snr,
        Integer rssi,
        Position position,
        DeviceMetrics deviceMetrics)
{
    public MeshNodeRecord
    {
        if (nodeNumber < 0 || nodeNumber > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("nodeNumber out of range: " + nodeNumber);
        }
        Objects.requireNonNull(nodeId, "nodeId");
    }

    /**
     * Creates an empty record for a node seen for the first time.
     */
    public static MeshNodeRecord firstSeen(long nodeNumber)
    {
        return new MeshNodeRecord(nodeNumber, defaultNodeId(nodeNumber),
                null, null, null, null, null, null, null);
    }

    /**
     * Canonical mesh ID string for a node number, e.g. {@code !00bc614e}.
     */
    public static String defaultNodeId(long nodeNumber)
    {
        return String.format("!%08x", nodeNumber);
    }

    /**
     * Best human-readable name: long name, else short name, else the ID string.
     */
    public String displayName()
    {
        if (longName != null && !longName.isBlank()) {
            return longName;
        }
        if (shortName != null && !shortName.isBlank()) {
            return shortName;
        }
        return nodeId;
    }

    /**
     * Name used when relaying the node's traffic: short name, else long name,
     * else the ID string.
     */
    public String chatName()
    {
        if (shortName != null && !shortName.isBlank()) {
            return shortName;
        }
        if (longName != null && !longName.isBlank()) {
            return longName;
        }
        return nodeId;
    }

    /**
     * Returns a copy with {@code update} merged over this record. Fields the
     * update does not carry keep their current value.
     */
    public MeshNodeRecord merge(NodeUpdate update)
    {
        Objects.requireNonNull(update, "update");
        return new MeshNodeRecord(
                nodeNumber,
                update.nodeId() != null ? update.nodeId() : nodeId,
                update.shortName() != null ? update.shortName() : shortName,
                update.longName() != null ? update.longName() : longName,
                update.heardAt() != null ? update.heardAt() : lastHeard,
                update.snr() != null ? update.snr() : snr,
                update.rssi() != null ? update.rssi() : rssi,
                update.position() != null ? update.position() : position,
                update.deviceMetrics() != null ? update.deviceMetrics() : deviceMetrics);
    }
}
