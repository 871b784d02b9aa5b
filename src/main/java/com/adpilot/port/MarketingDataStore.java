package com.adpilot.port;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of businesses, campaigns and campaign metrics, owned by the host application.
 */
public interface MarketingDataStore {

    Optional<Business> findBusinessById(String businessId);

    List<Business> findBusinessesByStatus(BusinessStatus status);

    /**
     * Businesses in status ACTIVE; with {@code withRecentMetrics} only those that reported metrics recently.
     */
    List<Business> findActiveBusinesses(boolean withRecentMetrics);

    Optional<Campaign> findCampaignById(String campaignId);

    /**
     * @param status filter; {@code null} returns campaigns in any status
     */
    List<Campaign> findCampaignsByBusiness(String businessId, CampaignStatus status);

    void updateBusiness(String businessId, BusinessUpdate update);

    void updateCampaign(String campaignId, CampaignUpdate update);

    void saveCampaignMetrics(CampaignMetricsSnapshot snapshot);

    long countBusinessesByOwner(String ownerId);
}
