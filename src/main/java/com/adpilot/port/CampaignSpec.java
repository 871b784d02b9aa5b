package com.adpilot.port;

import java.math.BigDecimal;
import java.util.List;

public record CampaignSpec(String name, String targetAudience, BigDecimal dailyBudget, int durationDays,
        List<String> keywords) {
}
