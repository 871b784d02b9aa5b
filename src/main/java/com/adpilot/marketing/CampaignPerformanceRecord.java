package com.adpilot.marketing;

import com.adpilot.port.DateRange;

/**
 * Metrics of one campaign over an analysis window, with the derived ratios and score.
 * Ratios with a zero denominator are 0.
 */
public record CampaignPerformanceRecord(
        String campaignId,
        DateRange window,
        long impressions,
        long clicks,
        long conversions,
        double spend,
        double revenue,
        double ctr,
        double cpc,
        double costPerConversion,
        double roas,
        int performanceScore,
        long ageDays) {
}
