package com.adpilot.marketing;

import java.time.OffsetDateTime;
import java.util.List;

public record BusinessDecision(
        String businessId,
        String businessName,
        BusinessAction decision,
        double confidence,
        List<String> reasons,
        List<CampaignDecision> campaignDecisions,
        OffsetDateTime evaluatedAt,
        OffsetDateTime nextEvaluationDate) {

    public BusinessDecision {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        campaignDecisions = campaignDecisions != null ? List.copyOf(campaignDecisions) : List.of();
    }

    public long countCampaigns(CampaignAction action) {
        return campaignDecisions.stream().filter(decision -> decision.action() == action).count();
    }
}
