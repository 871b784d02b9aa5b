package com.adpilot.abtest;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Outcome of analyzing a test.
 *
 * @param improvement relative score lead of the best variant over the runner-up
 * @param winningVariantId best variant when the result is significant, otherwise {@code null}
 */
public record AbTestResult(
        String testId,
        String campaignId,
        AbTestStatus status,
        List<VariantResult> results,
        boolean significant,
        double improvement,
        double confidence,
        String winningVariantId,
        List<String> recommendations,
        OffsetDateTime startedAt,
        OffsetDateTime analyzedAt) {

    public AbTestResult {
        results = List.copyOf(results);
        recommendations = List.copyOf(recommendations);
    }
}
