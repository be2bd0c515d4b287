package com.questrail.meshgate.correlation;

import com.questrail.meshgate.mesh.RequestId;

import java.util.Objects;

/**
 * One outstanding correlated mesh request.
 *
 * <p>The target is captured by value (number, ID string and display name at
 * issue time) so the outcome line still reads correctly if the node is renamed
 * while the request is in flight.</p>
 *
 * @param createdAtNanos monotonic time the request was issued
 * @param deadlineNanos  monotonic time after which the request is timed out
 */
public record PendingRequest(
        RequestId requestId,
        RequestKind kind,
        String requester,
        long targetNodeNumber,
        String targetNodeId,
        String targetName,
        long createdAtNanos,
        long deadlineNanos)
{
    public PendingRequest
    {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetName, "targetName");
        if (deadlineNanos < createdAtNanos) {
            throw new IllegalArgumentException("deadline precedes creation");
        }
    }

    /** {@code <name> (<id>)} as shown in outcome lines. */
    public String targetLabel()
    {
        return targetName + " (" + targetNodeId + ")";
    }
}
