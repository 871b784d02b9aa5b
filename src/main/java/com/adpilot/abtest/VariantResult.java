package com.adpilot.abtest;

public record VariantResult(
        String variantId,
        String name,
        String description,
        VariantMetrics metrics,
        double performanceScore,
        ConfidenceInterval confidenceInterval) {

    public record ConfidenceInterval(double lower, double upper) {
    }
}
