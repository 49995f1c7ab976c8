package com.shlokmestry.bandwidth.web;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import com.shlokmestry.bandwidth.limit.LimitResolver;
import com.shlokmestry.bandwidth.observability.BandwidthMetrics;
import com.shlokmestry.bandwidth.placeholder.RequestPlaceholderReplacer;
import com.shlokmestry.bandwidth.ratelimit.CancellationSignal;
import com.shlokmestry.bandwidth.ratelimit.TokenBucket;
import com.shlokmestry.bandwidth.rules.BandwidthRule;
import com.shlokmestry.bandwidth.rules.BandwidthRules;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Paces response bodies of requests matched by a bandwidth rule.
 *
 * <p>The request's {@link CancellationSignal} is published as request attribute
 * {@link CancellationSignal#REQUEST_ATTRIBUTE}; it is cancelled on async timeout or error
 * and when the client connection fails.
 */
public class BandwidthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BandwidthFilter.class);

    private final BandwidthRules rules;
    private final BandwidthMetrics metrics;
    private final UrlPathHelper pathHelper = new UrlPathHelper();

    public BandwidthFilter(BandwidthRules rules, BandwidthMetrics metrics) {
        this.rules = rules;
        this.metrics = metrics;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Optional<BandwidthRule> match = rules.match(pathHelper.getPathWithinApplication(request));
        if (match.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        BandwidthRule rule = match.get();
        RequestPlaceholderReplacer replacer = new RequestPlaceholderReplacer(request);
        Optional<TokenBucket> bucket = rule.resolver().limiterFor(replacer);
        if (bucket.isEmpty()) {
            if (rule.resolver().config().isTemplated()) {
                failOpen(rule, replacer);
            }
            chain.doFilter(request, response);
            return;
        }

        CancellationSignal signal = new CancellationSignal();
        request.setAttribute(CancellationSignal.REQUEST_ATTRIBUTE, signal);
        ThrottledResponseWrapper throttled = new ThrottledResponseWrapper(response, bucket.get(), signal);
        try {
            chain.doFilter(request, throttled);
        } finally {
            if (request.isAsyncStarted()) {
                request.getAsyncContext().addListener(new PacingListener(rule, throttled, signal));
            } else {
                throttled.finish();
                record(rule, throttled, signal);
            }
        }
    }

    private void failOpen(BandwidthRule rule, RequestPlaceholderReplacer replacer) {
        String value = rule.resolver().substitute(replacer);
        String reason = LimitResolver.parseLimit(value).isPresent() ? "non_positive" : "unparseable";
        metrics.unresolved(rule.name(), reason);
        log.warn("bandwidth fail_open rule={} reason={} template={} value='{}'",
                rule.name(), reason, rule.resolver().config().limitTemplate(), value);
    }

    private void record(BandwidthRule rule, ThrottledResponseWrapper throttled, CancellationSignal signal) {
        metrics.paced(rule.name(), throttled.bytesWritten(), throttled.waitedNanos());
        if (signal.isCancelled()) {
            metrics.cancelled(rule.name());
            log.info("bandwidth cancelled rule={} reason={} bytes={}",
                    rule.name(), signal.reason(), throttled.bytesWritten());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("bandwidth paced rule={} limit={} bytes={} waitedMs={}",
                    rule.name(), throttled.bucket().bytesPerSecond(), throttled.bytesWritten(),
                    Duration.ofNanos(throttled.waitedNanos()).toMillis());
        }
    }

    private final class PacingListener implements AsyncListener {

        private final BandwidthRule rule;
        private final ThrottledResponseWrapper throttled;
        private final CancellationSignal signal;

        PacingListener(BandwidthRule rule, ThrottledResponseWrapper throttled, CancellationSignal signal) {
            this.rule = rule;
            this.throttled = throttled;
            this.signal = signal;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            throttled.finish();
            record(rule, throttled, signal);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            signal.cancel("async timeout");
        }

        @Override
        public void onError(AsyncEvent event) {
            signal.cancel("async error");
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
