package com.shlokmestry.bandwidth.limit;

import java.util.List;

import com.shlokmestry.bandwidth.placeholder.Placeholders;

/**
 * A configured byte-rate limit: either a fixed number of bytes/second, or a template with
 * {@code {key}} placeholders resolved per request. Exactly one of the two is set.
 *
 * @param limit fixed bytes/second; ignored when {@code limitTemplate} is set
 * @param limitTemplate placeholder template, or null for a fixed limit
 */
public record RateLimitConfig(int limit, String limitTemplate) {

    public static final String LIMIT_DIRECTIVE = "limit";

    public static RateLimitConfig fixed(int limit) {
        return new RateLimitConfig(limit, null);
    }

    public static RateLimitConfig templated(String limitTemplate) {
        if (!Placeholders.containsPlaceholder(limitTemplate)) {
            throw new IllegalArgumentException("not a placeholder template: " + limitTemplate);
        }
        return new RateLimitConfig(0, limitTemplate);
    }

    /**
     * Builds a config from a directive and its arguments. {@code limit} is the only
     * directive and takes exactly one argument; a value without placeholders is parsed here.
     *
     * @throws InvalidBandwidthConfigException on an unknown directive, wrong argument count
     *         or a fixed value that is not an integer
     */
    public static RateLimitConfig fromDirective(String directive, List<String> args) {
        if (!LIMIT_DIRECTIVE.equals(directive)) {
            throw new InvalidBandwidthConfigException("unrecognized parameter '" + directive + "'");
        }
        if (args == null || args.size() != 1) {
            throw new InvalidBandwidthConfigException(
                    "wrong argument count for '" + LIMIT_DIRECTIVE + "': expected 1, got "
                            + (args == null ? 0 : args.size()));
        }

        String value = args.get(0);
        if (Placeholders.containsPlaceholder(value)) {
            return templated(value);
        }
        try {
            return fixed(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new InvalidBandwidthConfigException("parsing limit value: '" + value + "' is not an integer", e);
        }
    }

    public boolean isTemplated() {
        return limitTemplate != null;
    }
}
