package com.shlokmestry.bandwidth.observability;

import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

@Component
public class BandwidthMetrics {

    private final MeterRegistry registry;

    public BandwidthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void paced(String rule, long bytes, long waitedNanos) {
        Counter.builder("bandwidth.bytes.total")
                .description("Bytes written through paced responses")
                .baseUnit("bytes")
                .tag("rule", rule)
                .register(registry)
                .increment(bytes);

        Timer.builder("bandwidth.wait")
                .description("Time a response spent waiting for tokens")
                .tag("rule", rule)
                .register(registry)
                .record(waitedNanos, TimeUnit.NANOSECONDS);
    }

    public void unresolved(String rule, String reason) {
        Counter.builder("bandwidth.limit.unresolved.total")
                .description("Templated limits that did not resolve; the request was not paced")
                .tag("rule", rule)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void cancelled(String rule) {
        Counter.builder("bandwidth.write.cancelled.total")
                .description("Paced writes abandoned because the request was cancelled")
                .tag("rule", rule)
                .register(registry)
                .increment();
    }
}
