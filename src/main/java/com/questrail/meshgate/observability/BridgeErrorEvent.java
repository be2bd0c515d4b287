package com.questrail.meshgate.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly inside the bridge.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
