package com.adpilot.worker;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.marketing.CampaignDecision;
import com.adpilot.marketing.CampaignPerformanceAnalyzer;
import com.adpilot.marketing.CampaignPerformanceRecord;
import com.adpilot.port.Business;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignMetricsSnapshot;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.port.PlatformMetrics;
import com.adpilot.queue.JobPayloads.CampaignMonitor;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Collects current metrics of launched campaigns and stores a scored snapshot per campaign.
 */
@Component
@Job(JobType.CAMPAIGN_MONITOR)
public class CampaignMonitorWorker implements JobWorker<CampaignMonitor> {

    private static final Logger log = LoggerFactory.getLogger(CampaignMonitorWorker.class);

    private final MarketingDataStore dataStore;
    private final CampaignPerformanceAnalyzer analyzer;
    private final AdPilotProperties properties;

    public CampaignMonitorWorker(MarketingDataStore dataStore, CampaignPerformanceAnalyzer analyzer,
            AdPilotProperties properties) {
        this.dataStore = dataStore;
        this.analyzer = analyzer;
        this.properties = properties;
    }

    @Override
    public JobResult process(UUID jobId, CampaignMonitor payload) {
        int window = properties.getDecision().getAnalysisWindowDays();
        Map<String, String> failures = new LinkedHashMap<>();
        int monitored = 0;
        List<Campaign> campaigns = campaignsInScope(payload);
        for (Campaign campaign : campaigns) {
            if (!campaign.hasExternalId()) {
                log.debug("Skipping campaign {} without external id", campaign.id());
                continue;
            }
            try {
                Business business = dataStore.findBusinessById(campaign.businessId())
                        .orElseThrow(() -> new PermanentException("Business not found: " + campaign.businessId()));
                CampaignDecision decision = analyzer.analyzeCampaign(business, campaign, window);
                dataStore.saveCampaignMetrics(snapshot(decision.performance()));
                monitored++;
            } catch (RuntimeException e) {
                log.error("Failed to monitor campaign {}", campaign.id(), e);
                failures.put(campaign.id(), e.getMessage());
            }
        }

        if (monitored == 0 && !failures.isEmpty()) {
            return JobResult.retry("Metrics collection failed for all " + failures.size() + " campaign(s)");
        }
        log.info("Monitored {} campaign(s), {} failure(s)", monitored, failures.size());
        return JobResult.success(Map.of("monitored", monitored, "failures", failures));
    }

    private List<Campaign> campaignsInScope(CampaignMonitor payload) {
        if (payload.campaignId() != null) {
            Campaign campaign = dataStore.findCampaignById(payload.campaignId())
                    .orElseThrow(() -> new PermanentException("Campaign not found: " + payload.campaignId()));
            return List.of(campaign);
        }
        if (payload.businessId() != null) {
            return dataStore.findCampaignsByBusiness(payload.businessId(), CampaignStatus.ACTIVE);
        }
        List<Campaign> campaigns = new ArrayList<>();
        for (Business business : dataStore.findActiveBusinesses(false)) {
            campaigns.addAll(dataStore.findCampaignsByBusiness(business.id(), CampaignStatus.ACTIVE));
        }
        return campaigns;
    }

    private static CampaignMetricsSnapshot snapshot(CampaignPerformanceRecord record) {
        PlatformMetrics metrics = new PlatformMetrics(record.impressions(), record.clicks(), record.conversions(),
                BigDecimal.valueOf(record.spend()), BigDecimal.valueOf(record.revenue()));
        return new CampaignMetricsSnapshot(record.campaignId(), record.window(), metrics, record.performanceScore(),
                record.roas(), OffsetDateTime.now());
    }
}
