package com.questrail.meshgate.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything the gateway decides on: pending-request deadlines,
 * the registration grace period, simulator delays and reconnect back-off.
 *
 * <p>Wall-clock time ({@link WallClock}) is used only for what operators read:
 * last-heard stamps, the TIME command, log lines.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
