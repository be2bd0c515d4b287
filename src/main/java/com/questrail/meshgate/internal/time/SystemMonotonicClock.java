package com.questrail.meshgate.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}. Unaffected by NTP
 * steps or manual clock changes, which is what deadline arithmetic needs.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
