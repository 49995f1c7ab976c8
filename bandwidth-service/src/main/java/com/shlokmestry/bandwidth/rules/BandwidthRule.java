package com.shlokmestry.bandwidth.rules;

import java.util.List;

import com.shlokmestry.bandwidth.limit.LimitResolver;

public record BandwidthRule(
        String name,
        List<String> paths,
        LimitResolver resolver
) {}
