package com.questrail.meshgate.internal.time;

/**
 * Cancellation handle for a task armed on a {@link MonotonicScheduler}.
 *
 * <p>Implemented by the executor-backed scheduler in production and by the
 * deterministic scheduler in tests.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
