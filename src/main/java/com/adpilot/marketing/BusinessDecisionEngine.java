package com.adpilot.marketing;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.port.AdvisorySignal;
import com.adpilot.port.AdvisorySignalProvider;
import com.adpilot.port.Business;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.MarketingDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aggregates the recommendations of a business's active campaigns into one business-level decision.
 */
@Service
public class BusinessDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(BusinessDecisionEngine.class);

    static final int MATURE_BUSINESS_DAYS = 14;
    static final double MAX_ADVISED_CONFIDENCE = 0.95;

    private final MarketingDataStore dataStore;
    private final CampaignPerformanceAnalyzer analyzer;
    private final AdPilotProperties.Decision settings;
    private final ObjectProvider<AdvisorySignalProvider> advisor;
    private final Clock clock;

    @Autowired
    public BusinessDecisionEngine(MarketingDataStore dataStore, CampaignPerformanceAnalyzer analyzer,
            AdPilotProperties properties, ObjectProvider<AdvisorySignalProvider> advisor) {
        this(dataStore, analyzer, properties, advisor, Clock.systemUTC());
    }

    BusinessDecisionEngine(MarketingDataStore dataStore, CampaignPerformanceAnalyzer analyzer,
            AdPilotProperties properties, ObjectProvider<AdvisorySignalProvider> advisor, Clock clock) {
        this.dataStore = dataStore;
        this.analyzer = analyzer;
        this.settings = properties.getDecision();
        this.advisor = advisor;
        this.clock = clock;
    }

    /**
     * Analyzes every active campaign of the business over the last {@code windowDays} days and decides.
     *
     * @throws PermanentException when the business does not exist
     */
    public BusinessDecision evaluate(String businessId, int windowDays) {
        Business business = dataStore.findBusinessById(businessId)
                .orElseThrow(() -> new PermanentException("Business not found: " + businessId));
        int window = windowDays > 0 ? windowDays : settings.getAnalysisWindowDays();

        List<Campaign> campaigns = dataStore.findCampaignsByBusiness(businessId, CampaignStatus.ACTIVE);
        List<CampaignDecision> campaignDecisions = new ArrayList<>(campaigns.size());
        for (Campaign campaign : campaigns) {
            // the store may ignore the status filter
            if (campaign.status() == CampaignStatus.ACTIVE) {
                campaignDecisions.add(analyzer.analyzeCampaign(business, campaign, window));
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        BusinessDecision decision = decide(business, campaignDecisions, business.ageInDays(now), now);
        decision = applyAdvisory(business, decision, business.ageInDays(now));
        log.info("Business {} ({}): {} with confidence {} over {} active campaign(s)", business.name(),
                business.id(), decision.decision(), decision.confidence(), campaignDecisions.size());
        return decision;
    }

    /**
     * Rule-based decision over already computed campaign recommendations. Has no side effects.
     */
    public BusinessDecision decide(Business business, List<CampaignDecision> campaignDecisions, long ageDays,
            OffsetDateTime now) {
        List<String> reasons = new ArrayList<>();
        OffsetDateTime nextEvaluation = now.plusDays(1);

        int total = campaignDecisions.size();
        if (total == 0) {
            reasons.add("No active campaigns to evaluate");
            return new BusinessDecision(business.id(), business.name(), BusinessAction.MAINTAIN, 0.6, reasons,
                    campaignDecisions, now, nextEvaluation);
        }

        double avgScore = campaignDecisions.stream()
                .mapToDouble(decision -> decision.performance().performanceScore())
                .average()
                .orElse(0);
        double avgRoas = campaignDecisions.stream()
                .mapToDouble(decision -> decision.performance().roas())
                .average()
                .orElse(0);
        long scaling = count(campaignDecisions, CampaignAction.SCALE);
        long pausing = count(campaignDecisions, CampaignAction.PAUSE);
        long optimizing = count(campaignDecisions, CampaignAction.OPTIMIZE);

        BusinessAction action;
        double confidence;
        if (ageDays >= MATURE_BUSINESS_DAYS) {
            if (avgScore >= settings.getScaleScore() && avgRoas >= 3.0) {
                action = BusinessAction.SCALE;
                confidence = 0.9;
                reasons.add("Excellent overall performance (Score: " + format(avgScore, 1) + "/100, ROAS: "
                        + format(avgRoas, 2) + ")");
                reasons.add(scaling + "/" + total + " campaigns recommended for scaling");
            } else if (avgScore < settings.getPauseScore() || avgRoas < 1.0) {
                if (pausing == total) {
                    action = BusinessAction.CLOSE;
                    confidence = 0.85;
                    reasons.add("All campaigns underperforming for 2+ weeks");
                    reasons.add("Average ROAS: " + format(avgRoas, 2) + " (below 1.0 threshold)");
                    reasons.add("Business not meeting viability criteria");
                } else {
                    action = BusinessAction.PAUSE;
                    confidence = 0.8;
                    reasons.add("Poor overall performance requiring optimization");
                    reasons.add(pausing + "/" + total + " campaigns need pausing");
                }
            } else if (optimizing > 0 || avgScore < 60) {
                action = BusinessAction.OPTIMIZE;
                confidence = 0.75;
                reasons.add("Mixed campaign performance requiring optimization");
                reasons.add(optimizing + "/" + total + " campaigns need optimization");
            } else if (scaling > pausing) {
                action = BusinessAction.SCALE;
                confidence = 0.7;
                reasons.add("More campaigns scaling than pausing");
            } else {
                action = BusinessAction.MAINTAIN;
                confidence = 0.8;
                reasons.add("Stable performance across campaigns");
            }
        } else if (avgScore >= 80 && avgRoas >= 2.5) {
            action = BusinessAction.SCALE;
            confidence = 0.7;
            reasons.add("Strong early performance indicators");
        } else if (avgScore < 25) {
            action = BusinessAction.OPTIMIZE;
            confidence = 0.6;
            reasons.add("Early optimization needed");
        } else {
            action = BusinessAction.MAINTAIN;
            confidence = 0.8;
            reasons.add("Business in learning phase, monitoring closely");
        }

        return new BusinessDecision(business.id(), business.name(), action, confidence, reasons, campaignDecisions,
                now, nextEvaluation);
    }

    /**
     * Lets the optional advisor raise the confidence of a decision. The action is never changed and
     * advisor failures leave the decision as it is.
     */
    BusinessDecision applyAdvisory(Business business, BusinessDecision decision, long ageDays) {
        AdvisorySignalProvider provider = advisor.getIfAvailable();
        if (provider == null) {
            return decision;
        }
        AdvisorySignal signal;
        try {
            signal = provider.evaluate(new AdvisorySignalProvider.AdvisoryRequest(
                    business.id(),
                    decision.decision().name(),
                    decision.campaignDecisions().size(),
                    averageScore(decision),
                    averageRoas(decision),
                    ageDays));
        } catch (RuntimeException e) {
            log.warn("Advisory signal unavailable for business {}: {}", business.id(), e.getMessage());
            return decision;
        }
        if (signal == null || !(signal.confidence() > decision.confidence())) {
            return decision;
        }
        List<String> reasons = new ArrayList<>(decision.reasons());
        reasons.add("AI insights: " + signal.reasoning());
        return new BusinessDecision(decision.businessId(), decision.businessName(), decision.decision(),
                Math.min(MAX_ADVISED_CONFIDENCE, signal.confidence()), reasons, decision.campaignDecisions(),
                decision.evaluatedAt(), decision.nextEvaluationDate());
    }

    private static double averageScore(BusinessDecision decision) {
        return decision.campaignDecisions().stream()
                .mapToDouble(campaign -> campaign.performance().performanceScore())
                .average()
                .orElse(0);
    }

    private static double averageRoas(BusinessDecision decision) {
        return decision.campaignDecisions().stream()
                .mapToDouble(campaign -> campaign.performance().roas())
                .average()
                .orElse(0);
    }

    private static long count(List<CampaignDecision> decisions, CampaignAction action) {
        return decisions.stream().filter(decision -> decision.action() == action).count();
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
