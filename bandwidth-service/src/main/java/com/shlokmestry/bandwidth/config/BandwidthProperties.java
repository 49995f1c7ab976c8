package com.shlokmestry.bandwidth.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

/**
 * {@code bandwidth.*} settings. Unknown keys fail startup.
 */
@Validated
@ConfigurationProperties(prefix = "bandwidth", ignoreUnknownFields = false)
public record BandwidthProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("-100") int filterOrder,
        @Valid List<Rule> rules
) {

    public BandwidthProperties {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * @param name  identifies the rule in logs and metrics
     * @param paths Ant-style path patterns
     * @param limit the {@code limit} directive's arguments, whitespace separated; exactly one is expected
     */
    public record Rule(
            @NotBlank String name,
            @NotEmpty @DefaultValue("/**") List<String> paths,
            String limit
    ) {}
}
