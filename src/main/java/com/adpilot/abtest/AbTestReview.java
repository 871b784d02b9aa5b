package com.adpilot.abtest;

/**
 * What a periodic review did with one running test.
 */
public record AbTestReview(
        String testId,
        String campaignId,
        Action action,
        AbTestStatus status,
        String winningVariantId,
        double confidence,
        String recommendedAction) {

    public enum Action {
        CONTINUE,
        CONCLUDE,
        ERROR
    }
}
