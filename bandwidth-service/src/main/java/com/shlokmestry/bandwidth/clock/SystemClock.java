package com.shlokmestry.bandwidth.clock;

/**
 * Real clock backed by System.nanoTime(), so wall-clock adjustments do not affect it.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    private SystemClock() {
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
