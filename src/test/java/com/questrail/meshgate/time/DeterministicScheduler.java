package com.questrail.meshgate.time;

import com.questrail.meshgate.internal.time.Cancellable;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks scheduled by a
 * running task are eligible in the same pass if already due. Ties run in
 * scheduling order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
            }
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Advance {@code clock} by {@code duration} and run whatever fell due.
     */
    public void advanceAndRun(ManualMonotonicClock clock, Duration duration) {
        clock.advance(duration);
        runDueTasks();
    }

    /** Number of scheduled tasks that have neither run nor been cancelled. */
    public synchronized int pendingCount() {
        int count = 0;
        for (Scheduled s : queue) {
            if (!s.cancelled.get()) {
                count++;
            }
        }
        return count;
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
