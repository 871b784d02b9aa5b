package com.adpilot.abtest;

import java.util.Map;

/**
 * @param id          {@code variant_N}, numbered from 1 in setup order
 * @param lastMetrics metrics of the last analysis; {@code null} before the first one
 */
public record AbTestVariant(
        String id,
        String name,
        String description,
        Map<String, Object> config,
        double trafficPercentage,
        VariantMetrics lastMetrics) {

    public AbTestVariant {
        config = config != null ? Map.copyOf(config) : Map.of();
    }

    public AbTestVariant withMetrics(VariantMetrics metrics) {
        return new AbTestVariant(id, name, description, config, trafficPercentage, metrics);
    }
}
