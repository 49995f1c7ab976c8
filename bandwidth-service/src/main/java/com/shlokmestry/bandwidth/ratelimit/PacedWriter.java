package com.shlokmestry.bandwidth.ratelimit;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;

/**
 * Writes to a sink no faster than its {@link TokenBucket} allows.
 *
 * <p>A write is split into chunks of at most the bucket's burst, and each chunk is written
 * only after its tokens are acquired. Acquiring tokens for the whole payload at once would
 * hold every byte back until the full refill, so chunking keeps delivery smooth.
 *
 * <p>One instance per request; not thread-safe.
 */
public final class PacedWriter {

    private final OutputStream sink;
    private final TokenBucket bucket;
    private final CancellationSignal signal;

    private long bytesWritten;
    private long waitedNanos;

    public PacedWriter(OutputStream sink, TokenBucket bucket, CancellationSignal signal) {
        if (sink == null) throw new IllegalArgumentException("sink cannot be null");
        if (bucket == null) throw new IllegalArgumentException("bucket cannot be null");
        if (signal == null) throw new IllegalArgumentException("signal cannot be null");
        this.sink = sink;
        this.bucket = bucket;
        this.signal = signal;
    }

    /**
     * Writes {@code len} bytes of {@code b} starting at {@code off}.
     *
     * @return bytes written, always {@code len} when no exception is thrown
     * @throws WriteCancelledException if the request was cancelled while waiting;
     *         {@code bytesTransferred} holds the partial count
     * @throws PartialWriteException if the sink failed; {@code bytesWritten()} holds the partial count
     */
    public int write(byte[] b, int off, int len) throws IOException {
        int total = 0;
        int remaining = len;
        int offset = off;
        while (remaining > 0) {
            int chunk = bucket.burst();
            if (chunk <= 0) {
                chunk = 1;
            }
            if (remaining < chunk) {
                chunk = remaining;
            }

            try {
                Duration waited = bucket.acquire(chunk, signal);
                waitedNanos += waited.toNanos();
            } catch (WriteCancelledException e) {
                e.bytesTransferred = total;
                throw e;
            }

            try {
                sink.write(b, offset, chunk);
            } catch (IOException e) {
                throw new PartialWriteException(total, e);
            }
            total += chunk;
            bytesWritten += chunk;
            offset += chunk;
            remaining -= chunk;
        }
        return total;
    }

    public int write(byte[] b) throws IOException {
        return write(b, 0, b.length);
    }

    public void flush() throws IOException {
        sink.flush();
    }

    public long bytesWritten() {
        return bytesWritten;
    }

    public long waitedNanos() {
        return waitedNanos;
    }

    public TokenBucket bucket() {
        return bucket;
    }

    public CancellationSignal signal() {
        return signal;
    }
}
