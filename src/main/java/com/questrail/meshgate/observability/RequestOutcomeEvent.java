package com.questrail.meshgate.observability;

import java.time.Instant;

/**
 * Record representing the terminal outcome of a correlated mesh request.
 */
public record RequestOutcomeEvent(
    Instant timestamp,
    long requestId,
    String kind,
    String requester,
    String outcome
) {
}
