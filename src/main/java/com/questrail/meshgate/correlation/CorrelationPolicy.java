package com.questrail.meshgate.correlation;

import java.time.Duration;
import java.util.Objects;

/**
 * CorrelationPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for tracking outstanding mesh requests.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>ackTimeout</b>: how long a DM or ping may stay outstanding before it
 *       is reported to its requester as timed out.</li>
 *   <li><b>sweepInterval</b>: cadence of the expiry sweep. A request is reported
 *       at most one sweep interval after its deadline.</li>
 * </ul>
 */
public record CorrelationPolicy(
        Duration ackTimeout,
        Duration sweepInterval
) {
    public CorrelationPolicy {
        Objects.requireNonNull(ackTimeout, "ackTimeout");
        Objects.requireNonNull(sweepInterval, "sweepInterval");

        if (ackTimeout.isNegative() || ackTimeout.isZero()) {
            throw new IllegalArgumentException("ackTimeout must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    /**
     * Defaults: 30 s acknowledgement timeout, swept once per second.
     */
    public static CorrelationPolicy defaults() {
        return new CorrelationPolicy(Duration.ofSeconds(30), Duration.ofSeconds(1));
    }
}
