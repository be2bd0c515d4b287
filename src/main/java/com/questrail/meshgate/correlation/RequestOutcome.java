package com.questrail.meshgate.correlation;

import com.questrail.meshgate.mesh.SignalInfo;

import java.util.Objects;

/**
 * Terminal outcome reported by the mesh for a pending request.
 */
public sealed interface RequestOutcome
        permits RequestOutcome.Acknowledged, RequestOutcome.NegativeAcknowledged, RequestOutcome.Pong
{
    /** The destination confirmed delivery. */
    record Acknowledged() implements RequestOutcome {}

    /** The mesh gave up; {@code reason} is the radio's error code. */
    record NegativeAcknowledged(String reason) implements RequestOutcome
    {
        public NegativeAcknowledged
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** The pinged node answered. */
    record Pong(SignalInfo signal) implements RequestOutcome
    {
        public Pong
        {
            Objects.requireNonNull(signal, "signal");
        }
    }
}
