package com.shlokmestry.bandwidth.placeholder;

import java.util.Optional;
import java.util.function.Function;

public final class Placeholders {

    private Placeholders() {
    }

    /**
     * True if {@code s} has a {@code {} followed later by a {@code }} with at least one
     * character between them.
     */
    public static boolean containsPlaceholder(String s) {
        if (s == null) return false;
        int open = s.indexOf('{');
        if (open == -1) return false;
        int close = s.indexOf('}', open + 1);
        return close > open + 1;
    }

    /**
     * Replaces each {@code {key}} with {@code lookup(key)}, or {@code empty} when the lookup
     * has no value. An empty key {@code {}} also becomes {@code empty}; an unclosed brace is
     * copied as-is.
     */
    public static String replaceAll(String input, Function<String, Optional<String>> lookup, String empty) {
        if (input == null || input.indexOf('{') == -1) return input;

        StringBuilder out = new StringBuilder(input.length());
        int i = 0;
        while (i < input.length()) {
            int open = input.indexOf('{', i);
            if (open == -1) break;
            int close = input.indexOf('}', open + 1);
            if (close == -1) break;

            out.append(input, i, open);
            if (close == open + 1) {
                out.append(empty);
            } else {
                String key = input.substring(open + 1, close);
                out.append(lookup.apply(key).orElse(empty));
            }
            i = close + 1;
        }
        out.append(input, i, input.length());
        return out.toString();
    }
}
