package com.adpilot.port;

import java.time.OffsetDateTime;

/**
 * Partial update; {@code null} components are left unchanged.
 */
public record BusinessUpdate(BusinessStatus status, String closureReason, OffsetDateTime closedAt) {

    public static BusinessUpdate status(BusinessStatus status) {
        return new BusinessUpdate(status, null, null);
    }

    public static BusinessUpdate closed(String closureReason, OffsetDateTime closedAt) {
        return new BusinessUpdate(BusinessStatus.CLOSED, closureReason, closedAt);
    }
}
