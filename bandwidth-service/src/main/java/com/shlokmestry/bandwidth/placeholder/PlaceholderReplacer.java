package com.shlokmestry.bandwidth.placeholder;

/**
 * Expands {@code {key}} placeholders in a string to their current per-request values.
 */
@FunctionalInterface
public interface PlaceholderReplacer {

    /**
     * @param input string that may contain placeholders
     * @param empty value substituted for keys that have no value
     * @return the input with every recognised placeholder replaced
     */
    String replaceAll(String input, String empty);
}
