package com.adpilot.abtest;

import com.adpilot.port.PlatformMetrics;

/**
 * Counters of one variant plus the derived ratios. {@code ctr} and {@code conversionRate} are percentages.
 */
public record VariantMetrics(
        long impressions,
        long clicks,
        long conversions,
        double cost,
        double revenue,
        double ctr,
        double cpc,
        double conversionRate,
        double roas) {

    public static VariantMetrics from(PlatformMetrics metrics) {
        long impressions = metrics.impressions();
        long clicks = metrics.clicks();
        long conversions = metrics.conversions();
        double cost = metrics.cost().doubleValue();
        double revenue = metrics.conversionValue().doubleValue();
        return new VariantMetrics(
                impressions,
                clicks,
                conversions,
                cost,
                revenue,
                impressions > 0 ? clicks * 100.0 / impressions : 0,
                clicks > 0 ? cost / clicks : 0,
                clicks > 0 ? conversions * 100.0 / clicks : 0,
                cost > 0 ? revenue / cost : 0);
    }
}
