package com.questrail.meshgate.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot task scheduling expressed in monotonic ticks.
 *
 * <p>Periodic work (the pending-request sweep, simulated mesh traffic) re-arms
 * itself from inside the task, so a single primitive serves both the
 * production executor and the deterministic test scheduler.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in the {@link MonotonicClock#nowNanos()} timebase
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a relative delay measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
