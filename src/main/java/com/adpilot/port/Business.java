package com.adpilot.port;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * A business as seen by the decision engine.
 *
 * @param monthlyPrice revenue per conversion, used as the revenue proxy for ROAS
 * @param targetCpa    target cost per acquisition; {@code null} uses the configured default
 * @param launchedAt   when marketing started; {@code null} falls back to {@code createdAt}
 */
public record Business(
        String id,
        String name,
        String ownerId,
        BusinessStatus status,
        BigDecimal monthlyPrice,
        BigDecimal targetCpa,
        OffsetDateTime createdAt,
        OffsetDateTime launchedAt) {

    public long ageInDays(OffsetDateTime now) {
        OffsetDateTime start = launchedAt != null ? launchedAt : createdAt;
        if (start == null || start.isAfter(now)) {
            return 0;
        }
        return Duration.between(start, now).toDays();
    }
}
