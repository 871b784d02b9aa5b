package com.adpilot.port;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * A marketing campaign. The counters are the locally stored totals, used when the campaign has no
 * {@code externalId} on its ad platform yet.
 */
public record Campaign(
        String id,
        String businessId,
        String name,
        AdPlatform platform,
        CampaignStatus status,
        String externalId,
        BigDecimal budget,
        BigDecimal spent,
        long impressions,
        long clicks,
        long conversions,
        OffsetDateTime startDate) {

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }

    public long ageInDays(OffsetDateTime now) {
        if (startDate == null || startDate.isAfter(now)) {
            return 0;
        }
        return Duration.between(startDate, now).toDays();
    }
}
