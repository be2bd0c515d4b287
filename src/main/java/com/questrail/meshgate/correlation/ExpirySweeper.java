package com.questrail.meshgate.correlation;

import com.questrail.meshgate.internal.time.Cancellable;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Periodically times out pending requests.
 *
 * <p>Each run calls {@link RequestCorrelator#sweepExpired(long)} with the current
 * monotonic time, hands every resulting notice to {@code deliver}, and re-arms
 * itself one sweep interval later. The sweep runs on the scheduler, independent
 * of both client input and mesh events.</p>
 */
public final class ExpirySweeper
{
    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final RequestCorrelator correlator;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Consumer<RequesterNotice> deliver;

    private final Object lock = new Object();
    private Cancellable next;
    private boolean running;

    public ExpirySweeper(RequestCorrelator correlator,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         Consumer<RequesterNotice> deliver)
    {
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.deliver = Objects.requireNonNull(deliver, "deliver");
    }

    public void start()
    {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            arm();
        }
    }

    public void stop()
    {
        synchronized (lock) {
            running = false;
            if (next != null) {
                next.cancel();
                next = null;
            }
        }
    }

    /**
     * Runs one sweep now on the calling thread.
     */
    public void sweepNow()
    {
        List<RequesterNotice> expired = correlator.sweepExpired(clock.nowNanos());
        for (RequesterNotice notice : expired) {
            try {
                deliver.accept(notice);
            }
            catch (RuntimeException e) {
                log.error("Failed to deliver timeout notice to {}", notice.nickname(), e);
            }
        }
    }

    private void tick()
    {
        synchronized (lock) {
            if (!running) {
                return;
            }
        }
        try {
            sweepNow();
        }
        finally {
            synchronized (lock) {
                if (running) {
                    arm();
                }
            }
        }
    }

    private void arm()
    {
        long at = clock.nowNanos() + correlator.policy().sweepInterval().toNanos();
        next = scheduler.scheduleAtNanos(at, this::tick);
    }
}
