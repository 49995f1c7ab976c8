package com.shlokmestry.bandwidth.ratelimit;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag for a single request. Token waits block on it, so cancelling
 * wakes every writer currently paced for that request.
 */
public final class CancellationSignal {

    /** Request attribute under which the filter exposes the request's signal. */
    public static final String REQUEST_ATTRIBUTE = CancellationSignal.class.getName();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String reason) {
        synchronized (this) {
            if (this.reason == null) {
                this.reason = reason;
            }
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /** @return why the signal was cancelled, or null while it is still live */
    public String reason() {
        return reason;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the signal was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
