package com.adpilot.port;

import java.time.OffsetDateTime;

public record CampaignMetricsSnapshot(
        String campaignId,
        DateRange window,
        PlatformMetrics metrics,
        int performanceScore,
        double roas,
        OffsetDateTime capturedAt) {
}
