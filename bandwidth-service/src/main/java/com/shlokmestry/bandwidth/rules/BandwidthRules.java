package com.shlokmestry.bandwidth.rules;

import java.util.List;
import java.util.Optional;

import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

/**
 * Provisioned rules in configuration order. The first rule with a matching path pattern wins.
 */
public class BandwidthRules {

    private final List<BandwidthRule> rules;
    private final PathMatcher matcher = new AntPathMatcher();

    public BandwidthRules(List<BandwidthRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Optional<BandwidthRule> match(String path) {
        for (BandwidthRule rule : rules) {
            for (String pattern : rule.paths()) {
                if (matcher.match(pattern, path)) {
                    return Optional.of(rule);
                }
            }
        }
        return Optional.empty();
    }

    public List<BandwidthRule> all() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
