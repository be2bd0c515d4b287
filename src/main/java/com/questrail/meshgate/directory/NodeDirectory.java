package com.questrail.meshgate.directory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * NodeDirectory
 * =============================================================================
 * In-memory table of every mesh node the gateway has observed, keyed by node
 * number.
 *
 * <h2>Mutation discipline</h2>
 * The directory is written by the mesh event relay and read by command handlers
 * on connection threads. Each {@link #upsert} is one atomic
 * {@link ConcurrentMap#compute} on the node's key, so concurrent updates to the
 * same node are serialized and never lose fields. Records are immutable, so a
 * reader always sees a consistent record.
 *
 * <h2>Lifetime</h2>
 * Entries are never removed. Conflicting attributes resolve last-write-wins.
 *
 * <p>The directory also remembers which node is the gateway's own radio, as
 * reported by the mesh interface.</p>
 */
public final class NodeDirectory
{
    private final ConcurrentMap<Long, MeshNodeRecord> nodes = new ConcurrentHashMap<>();
    private volatile Long localNodeNumber;

    /**
     * Merges {@code update} into the record for {@code nodeNumber}, creating the
     * record if the node is new.
     *
     * @return the record as stored after the merge
     */
    public MeshNodeRecord upsert(long nodeNumber, NodeUpdate update)
    {
        Objects.requireNonNull(update, "update");
        return nodes.compute(nodeNumber, (key, existing) ->
                (existing != null ? existing : MeshNodeRecord.firstSeen(key)).merge(update));
    }

    public Optional<MeshNodeRecord> lookup(long nodeNumber)
    {
        return Optional.ofNullable(nodes.get(nodeNumber));
    }

    /**
     * Snapshot of all records in no particular order.
     */
    public List<MeshNodeRecord> all()
    {
        return List.copyOf(new ArrayList<>(nodes.values()));
    }

    public int size()
    {
        return nodes.size();
    }

    /**
     * Records which node is the gateway's own radio. Creates an empty record
     * for it if the node has not been seen yet.
     */
    public void setLocalNodeNumber(long nodeNumber)
    {
        nodes.computeIfAbsent(nodeNumber, MeshNodeRecord::firstSeen);
        this.localNodeNumber = nodeNumber;
    }

    public OptionalLong localNodeNumber()
    {
        Long n = localNodeNumber;
        return n == null ? OptionalLong.empty() : OptionalLong.of(n);
    }

    public Optional<MeshNodeRecord> localNode()
    {
        Long n = localNodeNumber;
        return n == null ? Optional.empty() : lookup(n);
    }
}
