package com.shlokmestry.bandwidth.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.junit.jupiter.api.Test;

import com.shlokmestry.bandwidth.clock.SystemClock;

/**
 * Writers sharing one bucket are capped together; writers with their own buckets are not.
 */
class SharedBucketConcurrencyTest {

    private static final int REQUESTS = 3;
    private static final int LIMIT = 100;

    private static long runConcurrentWrites(Supplier<TokenBucket> buckets) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(REQUESTS);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        List<PacedWriterTest.RecordingSink> sinks = new ArrayList<>();

        try {
            for (int i = 0; i < REQUESTS; i++) {
                PacedWriterTest.RecordingSink sink = new PacedWriterTest.RecordingSink();
                sinks.add(sink);
                PacedWriter writer = new PacedWriter(sink, buckets.get(), new CancellationSignal());
                results.add(executor.submit(() -> {
                    startLatch.await();
                    return writer.write(new byte[LIMIT]);
                }));
            }

            long start = System.nanoTime();
            startLatch.countDown();
            for (Future<Integer> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(LIMIT);
            }
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            for (PacedWriterTest.RecordingSink sink : sinks) {
                assertThat(sink.size()).isEqualTo(LIMIT);
            }
            return elapsedMs;
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void sharedBucket_capsAggregateThroughput() throws Exception {
        TokenBucket shared = new TokenBucket(SystemClock.instance(), LIMIT);

        long elapsedMs = runConcurrentWrites(() -> shared);

        // 300 bytes at 100 bytes/s with a 100 byte initial burst
        assertThat(elapsedMs).isGreaterThanOrEqualTo(1800L);
    }

    @Test
    void perRequestBuckets_doNotContend() throws Exception {
        long elapsedMs = runConcurrentWrites(() -> new TokenBucket(SystemClock.instance(), LIMIT));

        assertThat(elapsedMs).isLessThan(1000L);
    }

    @Test
    void sharedBucket_cancellingOneRequestDoesNotBlockOthers() throws Exception {
        TokenBucket shared = new TokenBucket(SystemClock.instance(), LIMIT);
        shared.reserve(LIMIT);

        CancellationSignal cancelled = new CancellationSignal();
        cancelled.cancel("client disconnected");
        PacedWriter victim = new PacedWriter(new PacedWriterTest.RecordingSink(), shared, cancelled);
        assertThatThrownBy(() -> victim.write(new byte[50])).isInstanceOf(WriteCancelledException.class);

        // nothing was reserved for the cancelled write; the next writer waits only for its own tokens
        PacedWriter survivor = new PacedWriter(new PacedWriterTest.RecordingSink(), shared, new CancellationSignal());
        long start = System.nanoTime();
        survivor.write(new byte[20]);
        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(600L);
    }
}
