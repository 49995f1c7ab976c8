package com.shlokmestry.bandwidth.ratelimit;

import java.time.Duration;

import com.shlokmestry.bandwidth.clock.Clock;

/**
 * Byte-rate token bucket:
 * - capacity (burst) = bytesPerSecond, starts full
 * - continuous refill at bytesPerSecond
 *
 * Callers reserve tokens up front and the balance may go negative, so concurrent callers
 * queue behind each other instead of racing for the same refill. One bucket may be shared
 * by every request of a rule.
 *
 * Thread-safety: synchronized accounting; waiting happens outside the lock.
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Clock clock;
    private final int capacity;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, int bytesPerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (bytesPerSecond <= 0) throw new IllegalArgumentException("bytesPerSecond <= 0");
        this.clock = clock;
        this.capacity = bytesPerSecond;
        this.tokens = bytesPerSecond;
        this.lastNanos = clock.nowNanos();
    }

    /** Largest number of tokens a single reservation may take. */
    public int burst() {
        return capacity;
    }

    public int bytesPerSecond() {
        return capacity;
    }

    /**
     * Takes {@code permits} tokens and returns how long the caller must wait before using them.
     */
    public synchronized Duration reserve(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        if (permits > capacity) {
            throw new IllegalArgumentException("permits " + permits + " exceed burst " + capacity);
        }
        refill();

        tokens -= permits;
        if (tokens >= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil(-tokens * NANOS_PER_SECOND / capacity));
    }

    /** Returns the tokens of an abandoned reservation. */
    public synchronized void cancelReservation(int permits) {
        refill();
        tokens = Math.min(capacity, tokens + permits);
    }

    /** Tokens currently available; negative while reservations are queued. */
    public synchronized double available() {
        refill();
        return tokens;
    }

    /**
     * Blocks until {@code permits} tokens are available or {@code signal} is cancelled.
     *
     * @return how long the caller waited
     * @throws WriteCancelledException if the signal is (or becomes) cancelled, or the thread is interrupted
     */
    public Duration acquire(int permits, CancellationSignal signal) throws WriteCancelledException {
        if (signal.isCancelled()) {
            throw new WriteCancelledException(signal.reason());
        }

        Duration wait = reserve(permits);
        if (wait.isZero()) {
            return wait;
        }

        try {
            if (signal.await(wait)) {
                cancelReservation(permits);
                throw new WriteCancelledException(signal.reason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelReservation(permits);
            signal.cancel("interrupted");
            WriteCancelledException cancelled = new WriteCancelledException("interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
        return wait;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = now - lastNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * (double) capacity / NANOS_PER_SECOND);
        }
        // a reading behind the last one rebases without adding tokens
        lastNanos = now;
    }
}
