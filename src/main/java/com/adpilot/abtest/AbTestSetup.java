package com.adpilot.abtest;

import java.util.List;
import java.util.Map;

/**
 * Request to start a test.
 *
 * @param trafficSplit      percentage per variant, in variant order; must add up to 100
 * @param minimumSampleSize impressions each variant needs before a winner can be significant;
 *                          {@code null} uses {@code adpilot.ab-testing.minimum-sample-size}
 */
public record AbTestSetup(
        String campaignId,
        AbTestType testType,
        List<VariantSetup> variants,
        List<Double> trafficSplit,
        SuccessMetric successMetric,
        int durationDays,
        Long minimumSampleSize) {

    public record VariantSetup(String name, String description, Map<String, Object> config) {
    }
}
