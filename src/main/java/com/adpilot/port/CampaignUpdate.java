package com.adpilot.port;

import java.math.BigDecimal;

/**
 * Partial update; {@code null} components are left unchanged.
 */
public record CampaignUpdate(CampaignStatus status, BigDecimal budget, String externalId) {

    public static CampaignUpdate status(CampaignStatus status) {
        return new CampaignUpdate(status, null, null);
    }

    public static CampaignUpdate budget(BigDecimal budget) {
        return new CampaignUpdate(null, budget, null);
    }

    public static CampaignUpdate launched(String externalId, CampaignStatus status) {
        return new CampaignUpdate(status, null, externalId);
    }
}
