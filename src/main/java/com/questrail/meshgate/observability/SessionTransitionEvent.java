package com.questrail.meshgate.observability;

import java.time.Instant;

/**
 * Record representing a registration state change of one chat session.
 *
 * <p>{@code nickname} is {@code null} while the session has not chosen one.</p>
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String connectionId,
    String nickname,
    String fromState,
    String toState
) {
}
