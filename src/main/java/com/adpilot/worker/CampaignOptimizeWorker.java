package com.adpilot.worker;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.execution.DecisionExecutor;
import com.adpilot.marketing.CampaignDecision;
import com.adpilot.marketing.CampaignPerformanceAnalyzer;
import com.adpilot.port.Business;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.queue.JobPayloads.CampaignOptimize;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Re-analyzes a campaign and applies the optimization that matches its recommendation. Without a campaign id
 * every active campaign of every active business is optimized.
 */
@Component
@Job(JobType.CAMPAIGN_OPTIMIZE)
public class CampaignOptimizeWorker implements JobWorker<CampaignOptimize> {

    private static final Logger log = LoggerFactory.getLogger(CampaignOptimizeWorker.class);

    static final double SCALE_UP_FACTOR = 1.2;
    static final double OPTIMIZE_FACTOR = 0.9;

    private final MarketingDataStore dataStore;
    private final CampaignPerformanceAnalyzer analyzer;
    private final DecisionExecutor executor;
    private final AdPilotProperties properties;

    public CampaignOptimizeWorker(MarketingDataStore dataStore, CampaignPerformanceAnalyzer analyzer,
            DecisionExecutor executor, AdPilotProperties properties) {
        this.dataStore = dataStore;
        this.analyzer = analyzer;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public JobResult process(UUID jobId, CampaignOptimize payload) {
        if (payload.campaignId() != null) {
            Campaign campaign = dataStore.findCampaignById(payload.campaignId())
                    .orElseThrow(() -> new PermanentException("Campaign not found: " + payload.campaignId()));
            if (campaign.status() != CampaignStatus.ACTIVE) {
                log.info("Campaign {} is {}, nothing to optimize", campaign.id(), campaign.status());
                return JobResult.success();
            }
            log.info("Optimizing campaign {} ({})", campaign.id(), payload.reason());
            return JobResult.success(optimize(campaign));
        }

        List<CampaignOptimization> optimized = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Business business : dataStore.findActiveBusinesses(false)) {
            for (Campaign campaign : dataStore.findCampaignsByBusiness(business.id(), CampaignStatus.ACTIVE)) {
                try {
                    optimized.add(optimize(campaign));
                } catch (RuntimeException e) {
                    log.error("Failed to optimize campaign {}", campaign.id(), e);
                    failures.put(campaign.id(), e.getMessage());
                }
            }
        }
        if (optimized.isEmpty() && !failures.isEmpty()) {
            return JobResult.retry("Optimization failed for all " + failures.size() + " campaign(s)");
        }
        log.info("Optimized {} campaign(s), {} failure(s)", optimized.size(), failures.size());
        return JobResult.success(Map.of("optimized", optimized, "failures", failures));
    }

    CampaignOptimization optimize(Campaign campaign) {
        Business business = dataStore.findBusinessById(campaign.businessId())
                .orElseThrow(() -> new PermanentException("Business not found: " + campaign.businessId()));
        CampaignDecision analysis = analyzer.analyzeCampaign(business, campaign,
                properties.getDecision().getAnalysisWindowDays());

        List<CampaignOptimization.Step> steps = new ArrayList<>();
        switch (analysis.action()) {
            case SCALE -> {
                executor.scaleCampaign(campaign.id(), SCALE_UP_FACTOR);
                steps.add(new CampaignOptimization.Step(OptimizationAction.BUDGET_INCREASE,
                        "Budget increased by 20% due to strong performance (ROAS: "
                                + String.format(Locale.ROOT, "%.2f", analysis.performance().roas()) + ")",
                        SCALE_UP_FACTOR));
            }
            case PAUSE -> {
                executor.pauseCampaign(campaign.id());
                steps.add(new CampaignOptimization.Step(OptimizationAction.PAUSE,
                        "Campaign paused due to poor performance (Score: "
                                + analysis.performance().performanceScore() + "/100)", null));
            }
            case OPTIMIZE -> {
                executor.scaleCampaign(campaign.id(), OPTIMIZE_FACTOR);
                steps.add(new CampaignOptimization.Step(OptimizationAction.BUDGET_DECREASE,
                        "Budget reduced by 10% for optimization period", OPTIMIZE_FACTOR));
                steps.add(new CampaignOptimization.Step(OptimizationAction.KEYWORD_OPTIMIZATION,
                        "Keyword analysis and optimization initiated", null));
            }
            case MAINTAIN -> steps.add(new CampaignOptimization.Step(OptimizationAction.BID_ADJUSTMENT,
                    "Minor bid adjustments for continued performance", null));
        }
        log.info("Campaign {} optimized with {} action(s)", campaign.id(), steps.size());
        return new CampaignOptimization(campaign.id(), analysis.action(), steps,
                CampaignPerformanceAnalyzer.expectedImpact(analysis));
    }
}
