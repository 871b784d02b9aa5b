package com.adpilot.marketing;

import com.adpilot.port.AdPlatform;

import java.util.List;

/**
 * Recommendation for one campaign.
 *
 * @param budgetChangeFactor multiplier applied to the budget on SCALE; {@code null} for other actions
 */
public record CampaignDecision(
        String campaignId,
        String campaignName,
        AdPlatform platform,
        CampaignAction action,
        Double budgetChangeFactor,
        List<String> reasons,
        CampaignPerformanceRecord performance) {

    public CampaignDecision {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}
