package com.questrail.meshgate.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Absolute deadlines are turned into relative delays at scheduling time using
 * the supplied clock; callers must compute deadlines on that same clock. The
 * executor is not owned here: the gateway runtime shuts it down.</p>
 *
 * <p>Tasks may run late under load but never before their deadline. A task
 * that throws is logged; the executor would otherwise keep the failure in an
 * unread future.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(() -> runLogged(task), delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    private static void runLogged(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed", e);
            throw e;
        }
    }
}
