package com.adpilot.worker;

import com.adpilot.marketing.CampaignAction;

import java.util.List;

public record CampaignOptimization(
        String campaignId,
        CampaignAction recommendation,
        List<Step> optimizations,
        String expectedImpact) {

    public record Step(OptimizationAction type, String description, Double value) {
    }
}
