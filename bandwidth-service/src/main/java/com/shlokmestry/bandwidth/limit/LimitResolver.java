package com.shlokmestry.bandwidth.limit;

import java.util.Optional;
import java.util.OptionalInt;

import com.shlokmestry.bandwidth.clock.Clock;
import com.shlokmestry.bandwidth.placeholder.PlaceholderReplacer;
import com.shlokmestry.bandwidth.ratelimit.TokenBucket;

/**
 * Decides which token bucket, if any, paces a request.
 *
 * <p>A fixed limit gets one bucket built here and shared by every request, so all of them
 * together stay under the limit. A templated limit gets a new bucket per request, so each
 * request is capped on its own. A limit that is not positive, or a template that does not
 * resolve to a positive integer, means no pacing.
 *
 * Thread-safety: immutable after construction; the shared bucket is itself thread-safe.
 */
public final class LimitResolver {

    private final RateLimitConfig config;
    private final Clock clock;
    private final TokenBucket sharedBucket;

    public LimitResolver(RateLimitConfig config, Clock clock) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        this.config = config;
        this.clock = clock;
        this.sharedBucket = !config.isTemplated() && config.limit() > 0
                ? new TokenBucket(clock, config.limit())
                : null;
    }

    public RateLimitConfig config() {
        return config;
    }

    /**
     * @return the effective bytes/second, or empty when no limiting applies
     */
    public OptionalInt resolveLimit(PlaceholderReplacer replacer) {
        if (!config.isTemplated()) {
            return config.limit() > 0 ? OptionalInt.of(config.limit()) : OptionalInt.empty();
        }
        OptionalInt parsed = parseLimit(replacer.replaceAll(config.limitTemplate(), ""));
        return parsed.isPresent() && parsed.getAsInt() > 0 ? parsed : OptionalInt.empty();
    }

    /**
     * @return the bucket pacing this request; the shared one for a fixed limit, a new one for a template
     */
    public Optional<TokenBucket> limiterFor(PlaceholderReplacer replacer) {
        if (!config.isTemplated()) {
            return Optional.ofNullable(sharedBucket);
        }
        OptionalInt limit = resolveLimit(replacer);
        if (limit.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TokenBucket(clock, limit.getAsInt()));
    }

    /** Substituted template value, for diagnostics. */
    public String substitute(PlaceholderReplacer replacer) {
        return config.isTemplated() ? replacer.replaceAll(config.limitTemplate(), "") : String.valueOf(config.limit());
    }

    /**
     * @return the integer {@code value} spells, of any sign, or empty if it is not one
     */
    public static OptionalInt parseLimit(String value) {
        if (value == null) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
