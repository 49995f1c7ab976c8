package com.shlokmestry.bandwidth.clock;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SystemClockTest {

    @Test
    void readingsNeverGoBackwards() {
        SystemClock clock = SystemClock.instance();

        long previous = clock.nowNanos();
        for (int i = 0; i < 10_000; i++) {
            long now = clock.nowNanos();
            assertThat(now).isGreaterThanOrEqualTo(previous);
            previous = now;
        }
    }

    @Test
    void measuresElapsedTime() throws InterruptedException {
        SystemClock clock = SystemClock.instance();

        long start = clock.nowNanos();
        Thread.sleep(50);

        assertThat(clock.nowNanos() - start).isGreaterThanOrEqualTo(50_000_000L);
    }
}
