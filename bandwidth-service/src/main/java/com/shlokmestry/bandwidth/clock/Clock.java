package com.shlokmestry.bandwidth.clock;

/**
 * Monotonic nanosecond time source. Only differences between readings are meaningful.
 */
public interface Clock {
    long nowNanos();
}
