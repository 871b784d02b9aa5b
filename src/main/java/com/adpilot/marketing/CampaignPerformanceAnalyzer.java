package com.adpilot.marketing;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.port.Business;
import com.adpilot.port.Campaign;
import com.adpilot.port.DateRange;
import com.adpilot.port.PlatformAdapterRegistry;
import com.adpilot.port.PlatformMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores campaigns from their raw platform metrics and recommends an action per campaign.
 */
@Service
public class CampaignPerformanceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CampaignPerformanceAnalyzer.class);

    static final int EARLY_STAGE_DAYS = 7;
    static final int MATURE_DAYS = 14;

    private final PlatformAdapterRegistry adapters;
    private final AdPilotProperties.Decision settings;
    private final Clock clock;

    @Autowired
    public CampaignPerformanceAnalyzer(PlatformAdapterRegistry adapters, AdPilotProperties properties) {
        this(adapters, properties, Clock.systemUTC());
    }

    CampaignPerformanceAnalyzer(PlatformAdapterRegistry adapters, AdPilotProperties properties, Clock clock) {
        this.adapters = adapters;
        this.settings = properties.getDecision();
        this.clock = clock;
    }

    /**
     * Collects the campaign's metrics over the last {@code windowDays} days and recommends an action.
     * Campaigns not yet launched on their platform are measured from their stored counters.
     */
    public CampaignDecision analyzeCampaign(Business business, Campaign campaign, int windowDays) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        DateRange window = DateRange.lastDays(windowDays, now.toLocalDate());
        PlatformMetrics metrics;
        if (campaign.hasExternalId()) {
            metrics = adapters.adapterFor(campaign.platform()).getMetrics(campaign.externalId(), window);
        } else {
            log.debug("Campaign {} has no external id; using stored counters", campaign.id());
            metrics = new PlatformMetrics(campaign.impressions(), campaign.clicks(), campaign.conversions(),
                    campaign.spent());
        }
        CampaignPerformanceRecord record = measure(campaign.id(), window, metrics, monthlyPrice(business),
                targetCpa(business), campaign.ageInDays(now));
        CampaignDecision decision = recommend(campaign, record);
        log.info("Campaign {} scored {}/100 (ROAS {}): {}", campaign.id(), record.performanceScore(),
                format(record.roas()), decision.action());
        return decision;
    }

    public CampaignPerformanceRecord measure(String campaignId, DateRange window, PlatformMetrics metrics,
            double monthlyPrice, double targetCpa, long ageDays) {
        long impressions = metrics.impressions();
        long clicks = metrics.clicks();
        long conversions = metrics.conversions();
        double spend = metrics.cost().doubleValue();
        double revenue = conversions * monthlyPrice;

        double ctr = ratio(clicks, impressions) * 100;
        double cpc = ratio(spend, clicks);
        double costPerConversion = ratio(spend, conversions);
        double roas = ratio(revenue, spend);
        int score = performanceScore(ctr, roas, conversions, costPerConversion, targetCpa);

        return new CampaignPerformanceRecord(campaignId, window, impressions, clicks, conversions, spend, revenue,
                ctr, cpc, costPerConversion, roas, score, ageDays);
    }

    /**
     * Weighted score in [0, 100]: CTR 30%, ROAS 40%, conversions 20%, cost efficiency 10%.
     * CTR saturates at 2%, ROAS at 3 and conversions at 10.
     */
    public static int performanceScore(double ctr, double roas, long conversions, double costPerConversion,
            double targetCpa) {
        double ctrScore = clamp(ctr / 2 * 100);
        double roasScore = clamp(roas / 3 * 100);
        double conversionScore = conversions > 0 ? clamp(conversions * 10.0) : 0;
        double efficiencyScore = costPerConversion > 0 ? clamp(targetCpa / costPerConversion * 100) : 0;
        double weighted = ctrScore * 0.3 + roasScore * 0.4 + conversionScore * 0.2 + efficiencyScore * 0.1;
        return (int) Math.round(weighted);
    }

    public CampaignDecision recommend(Campaign campaign, CampaignPerformanceRecord record) {
        int score = record.performanceScore();
        double roas = record.roas();
        long age = record.ageDays();
        List<String> reasons = new ArrayList<>();

        if (age <= EARLY_STAGE_DAYS) {
            if (score >= settings.getScaleScore() && roas >= 2) {
                reasons.add("Strong early performance indicators");
                reasons.add("High performance score: " + score + "/100");
                return decision(campaign, record, CampaignAction.SCALE, 1.2, reasons);
            }
            if (score < settings.getPauseScore()) {
                reasons.add("Poor early performance indicators");
                reasons.add("Needs optimization period");
                return decision(campaign, record, CampaignAction.OPTIMIZE, null, reasons);
            }
            reasons.add("Campaign in learning phase");
            return decision(campaign, record, CampaignAction.MAINTAIN, null, reasons);
        }

        if (score >= 80 && roas >= 3) {
            reasons.add("Excellent performance score: " + score + "/100");
            reasons.add("Strong ROAS: " + format(roas));
            return decision(campaign, record, CampaignAction.SCALE, 1.3, reasons);
        }
        if (score >= 60 && roas >= 2) {
            reasons.add("Good performance score: " + score + "/100");
            reasons.add("Healthy ROAS: " + format(roas));
            return decision(campaign, record, CampaignAction.SCALE, 1.15, reasons);
        }
        if (score < settings.getPauseScore() || roas < 1) {
            reasons.add("Poor performance score: " + score + "/100");
            reasons.add("Low ROAS: " + format(roas));
            if (age >= MATURE_DAYS) {
                reasons.add("Campaign underperforming for 2+ weeks");
                return decision(campaign, record, CampaignAction.PAUSE, null, reasons);
            }
            reasons.add("Requires optimization");
            return decision(campaign, record, CampaignAction.OPTIMIZE, null, reasons);
        }
        reasons.add("Campaign performing within acceptable range");
        return decision(campaign, record, CampaignAction.MAINTAIN, null, reasons);
    }

    public static String expectedImpact(CampaignDecision decision) {
        return switch (decision.action()) {
            case SCALE -> "Expected 15-25% increase in conversions with current ROAS of "
                    + format(decision.performance().roas());
            case PAUSE -> "Campaign costs eliminated, traffic redirected to better performing channels";
            case OPTIMIZE -> "Expected 10-20% improvement in efficiency over next 7-14 days";
            case MAINTAIN -> "Steady performance expected with minor efficiency improvements";
        };
    }

    double monthlyPrice(Business business) {
        BigDecimal price = business.monthlyPrice();
        return price != null ? price.doubleValue() : 0;
    }

    double targetCpa(Business business) {
        BigDecimal target = business.targetCpa();
        return target != null && target.signum() > 0 ? target.doubleValue() : settings.getDefaultTargetCpa();
    }

    private static CampaignDecision decision(Campaign campaign, CampaignPerformanceRecord record,
            CampaignAction action, Double factor, List<String> reasons) {
        return new CampaignDecision(campaign.id(), campaign.name(), campaign.platform(), action, factor, reasons,
                record);
    }

    private static double ratio(double numerator, double denominator) {
        if (denominator <= 0 || Double.isNaN(numerator)) {
            return 0;
        }
        double value = numerator / denominator;
        return Double.isFinite(value) ? value : 0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0;
        }
        return Math.min(100, value);
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
