package com.shlokmestry.bandwidth.config;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.shlokmestry.bandwidth.clock.Clock;
import com.shlokmestry.bandwidth.clock.SystemClock;
import com.shlokmestry.bandwidth.limit.InvalidBandwidthConfigException;
import com.shlokmestry.bandwidth.limit.LimitResolver;
import com.shlokmestry.bandwidth.limit.RateLimitConfig;
import com.shlokmestry.bandwidth.observability.BandwidthMetrics;
import com.shlokmestry.bandwidth.rules.BandwidthRule;
import com.shlokmestry.bandwidth.rules.BandwidthRules;
import com.shlokmestry.bandwidth.web.BandwidthFilter;

/**
 * Provisions bandwidth rules at startup. Any invalid rule aborts startup.
 */
@Configuration
@EnableConfigurationProperties(BandwidthProperties.class)
public class BandwidthConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BandwidthConfiguration.class);

    @Bean
    public BandwidthRules bandwidthRules(BandwidthProperties properties) {
        List<BandwidthRule> rules = new ArrayList<>();
        for (BandwidthProperties.Rule rule : properties.rules()) {
            rules.add(provision(rule, SystemClock.instance()));
        }
        return new BandwidthRules(rules);
    }

    @Bean
    @ConditionalOnProperty(prefix = "bandwidth", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<BandwidthFilter> bandwidthFilter(
            BandwidthRules rules,
            BandwidthMetrics metrics,
            BandwidthProperties properties
    ) {
        FilterRegistrationBean<BandwidthFilter> registration =
                new FilterRegistrationBean<>(new BandwidthFilter(rules, metrics));
        registration.setName("bandwidthFilter");
        registration.setOrder(properties.filterOrder());
        registration.addUrlPatterns("/*");
        return registration;
    }

    static BandwidthRule provision(BandwidthProperties.Rule rule, Clock clock) {
        RateLimitConfig config;
        try {
            config = RateLimitConfig.fromDirective(RateLimitConfig.LIMIT_DIRECTIVE, arguments(rule.limit()));
        } catch (InvalidBandwidthConfigException e) {
            throw new InvalidBandwidthConfigException("bandwidth rule '" + rule.name() + "': " + e.getMessage(), e);
        }

        LimitResolver resolver = new LimitResolver(config, clock);
        if (config.isTemplated()) {
            log.info("bandwidth provisioned rule={} mode=templated template={} paths={}",
                    rule.name(), config.limitTemplate(), rule.paths());
        } else if (config.limit() > 0) {
            log.info("bandwidth provisioned rule={} mode=fixed limit={} paths={}",
                    rule.name(), config.limit(), rule.paths());
        } else {
            log.info("bandwidth provisioned rule={} mode=disabled limit={} paths={}",
                    rule.name(), config.limit(), rule.paths());
        }
        return new BandwidthRule(rule.name(), rule.paths(), resolver);
    }

    // "limit: 10 20" is two arguments
    static List<String> arguments(String raw) {
        List<String> args = new ArrayList<>();
        if (raw == null) return args;
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isEmpty()) args.add(token);
        }
        return args;
    }
}
