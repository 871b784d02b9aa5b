package com.adpilot.port;

import com.adpilot.error.PermanentException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Outbound integration with one advertising platform. Implementations signal network or rate-limit
 * problems with {@link com.adpilot.error.TransientException} and missing credentials with
 * {@link com.adpilot.error.ConfigurationException}.
 */
public interface PlatformAdapter {

    AdPlatform platform();

    ExternalCampaign createCampaign(Business business, CampaignSpec spec);

    void updateBudget(String externalId, BigDecimal amount);

    void pause(String externalId);

    void resume(String externalId);

    PlatformMetrics getMetrics(String externalId, DateRange range);

    default void splitTraffic(String externalId, String testId, List<VariantAllocation> allocations) {
        throw new PermanentException(platform() + " does not support traffic splitting");
    }

    default PlatformMetrics getVariantMetrics(String externalId, String testId, String variantId) {
        throw new PermanentException(platform() + " does not report variant metrics");
    }

    default void applyConfiguration(String externalId, Map<String, Object> configuration) {
        throw new PermanentException(platform() + " does not support configuration updates");
    }
}
