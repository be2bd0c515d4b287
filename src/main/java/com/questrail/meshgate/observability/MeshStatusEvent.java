package com.questrail.meshgate.observability;

import java.time.Instant;

/**
 * Record representing a mesh link status change reported by the mesh interface.
 */
public record MeshStatusEvent(
    Instant timestamp,
    String status
) {
}
