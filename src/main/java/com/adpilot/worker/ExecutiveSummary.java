package com.adpilot.worker;

import com.adpilot.marketing.BusinessAction;
import com.adpilot.marketing.BusinessDecision;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ExecutiveSummary(
        int totalBusinesses,
        Map<BusinessAction, Long> decisions,
        double avgConfidence,
        long highConfidenceDecisions) {

    static final double HIGH_CONFIDENCE = 0.8;

    public static ExecutiveSummary of(List<BusinessDecision> decisions) {
        Map<BusinessAction, Long> counts = new EnumMap<>(BusinessAction.class);
        for (BusinessAction action : BusinessAction.values()) {
            counts.put(action, 0L);
        }
        for (BusinessDecision decision : decisions) {
            counts.merge(decision.decision(), 1L, Long::sum);
        }
        double avgConfidence = decisions.stream().mapToDouble(BusinessDecision::confidence).average().orElse(0);
        long highConfidence = decisions.stream().filter(decision -> decision.confidence() > HIGH_CONFIDENCE).count();
        return new ExecutiveSummary(decisions.size(), counts, avgConfidence, highConfidence);
    }
}
