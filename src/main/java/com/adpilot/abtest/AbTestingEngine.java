package com.adpilot.abtest;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.error.ValidationException;
import com.adpilot.execution.DecisionExecutor;
import com.adpilot.port.Campaign;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.port.PlatformAdapter;
import com.adpilot.port.PlatformAdapterRegistry;
import com.adpilot.port.PlatformMetrics;
import com.adpilot.port.VariantAllocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Runs variant experiments on campaigns: starts them on the ad platform, analyzes the collected metrics
 * and rolls out the winner.
 * <p>
 * A result is significant when the best variant's score leads the runner-up by more than the configured
 * threshold (10% by default) and every variant has more impressions than the test's minimum sample size.
 */
@Service
public class AbTestingEngine {

    private static final Logger log = LoggerFactory.getLogger(AbTestingEngine.class);

    static final double SPLIT_TOLERANCE = 0.1;
    static final double CONFIDENCE_CAP = 0.95;

    private final AbTestStore store;
    private final MarketingDataStore dataStore;
    private final PlatformAdapterRegistry adapters;
    private final DecisionExecutor executor;
    private final AdPilotProperties.AbTesting settings;
    private final Clock clock;

    @Autowired
    public AbTestingEngine(AbTestStore store, MarketingDataStore dataStore, PlatformAdapterRegistry adapters,
            DecisionExecutor executor, AdPilotProperties properties) {
        this(store, dataStore, adapters, executor, properties, Clock.systemUTC());
    }

    AbTestingEngine(AbTestStore store, MarketingDataStore dataStore, PlatformAdapterRegistry adapters,
            DecisionExecutor executor, AdPilotProperties properties, Clock clock) {
        this.store = store;
        this.dataStore = dataStore;
        this.adapters = adapters;
        this.executor = executor;
        this.settings = properties.getAbTesting();
        this.clock = clock;
    }

    public AbTest createTest(AbTestSetup setup) {
        validate(setup);
        Campaign campaign = dataStore.findCampaignById(setup.campaignId())
                .orElseThrow(() -> new PermanentException("Campaign not found: " + setup.campaignId()));

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<AbTestVariant> variants = new ArrayList<>();
        for (int i = 0; i < setup.variants().size(); i++) {
            AbTestSetup.VariantSetup variant = setup.variants().get(i);
            variants.add(new AbTestVariant("variant_" + (i + 1), variant.name(), variant.description(),
                    variant.config(), setup.trafficSplit().get(i), null));
        }
        long minimumSampleSize = setup.minimumSampleSize() != null
                ? setup.minimumSampleSize()
                : settings.getMinimumSampleSize();
        AbTest test = new AbTest(
                "ab_" + setup.campaignId() + "_" + now.toInstant().toEpochMilli(),
                setup.campaignId(),
                setup.testType(),
                variants,
                setup.successMetric(),
                setup.durationDays(),
                minimumSampleSize,
                AbTestStatus.RUNNING,
                null,
                null,
                null,
                null,
                now,
                null);
        store.insert(test);

        if (campaign.hasExternalId()) {
            List<VariantAllocation> allocations = variants.stream()
                    .map(variant -> new VariantAllocation(variant.id(), variant.trafficPercentage(), variant.config()))
                    .toList();
            adapters.adapterFor(campaign.platform()).splitTraffic(campaign.externalId(), test.testId(), allocations);
        } else {
            log.warn("Campaign {} has no external id; traffic split for test {} not sent to {}", campaign.id(),
                    test.testId(), campaign.platform());
        }
        log.info("Started A/B test {} on campaign {} ({} variants, {} for {} days)", test.testId(), campaign.id(),
                variants.size(), setup.successMetric(), setup.durationDays());
        return test;
    }

    /**
     * Collects variant metrics and evaluates the test. Does not modify the stored test.
     */
    public AbTestResult analyzeTest(String testId) {
        return analyze(requireTest(testId), OffsetDateTime.now(clock));
    }

    /**
     * Concludes a running test and rolls out the forced or the statistical winner. Concluding a test that is
     * no longer running returns its stored conclusion without side effects.
     *
     * @param forcedWinner variant to implement regardless of significance; {@code null} for the statistical one
     */
    public AbTest concludeTest(String testId, String forcedWinner) {
        AbTest test = requireTest(testId);
        if (test.status().isTerminal()) {
            log.info("A/B test {} already concluded as {}", testId, test.status());
            return test;
        }
        if (forcedWinner != null && !test.hasVariant(forcedWinner)) {
            throw new ValidationException("Unknown variant " + forcedWinner + " for A/B test " + testId);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        AbTestResult result = analyze(test, now);
        String winner = forcedWinner != null ? forcedWinner : result.winningVariantId();
        AbTestStatus status = winner != null ? AbTestStatus.COMPLETED : AbTestStatus.INCONCLUSIVE;
        String note = winner != null
                ? "Winning variant " + winner + " has been implemented"
                : "No statistically significant winner found, maintaining current configuration";

        AbTest concluded = test.withVariants(withMetrics(test, result))
                .concluded(status, result.significant(), result.confidence(), winner, note, now);
        if (!store.replaceIfStatus(concluded, AbTestStatus.RUNNING)) {
            log.info("A/B test {} was concluded concurrently", testId);
            return requireTest(testId);
        }

        if (winner == null) {
            log.warn("No clear winner for A/B test {}, maintaining current configuration", testId);
            return concluded;
        }
        try {
            executor.applyVariant(concluded, concluded.variant(winner));
            log.info("Implemented winning variant {} of A/B test {}", winner, testId);
            return concluded;
        } catch (RuntimeException e) {
            log.error("Failed to implement winning variant {} of A/B test {}", winner, testId, e);
            AbTest failed = concluded.withOutcomeNote("Winning variant " + winner + " could not be implemented: "
                    + e.getMessage());
            store.replaceIfStatus(failed, concluded.status());
            return failed;
        }
    }

    public AbTest stopTest(String testId) {
        AbTest test = requireTest(testId);
        if (test.status().isTerminal()) {
            return test;
        }
        AbTest stopped = test.concluded(AbTestStatus.STOPPED, null, null, null, "Stopped without implementing a winner",
                OffsetDateTime.now(clock));
        if (!store.replaceIfStatus(stopped, AbTestStatus.RUNNING)) {
            return requireTest(testId);
        }
        log.info("Stopped A/B test {}", testId);
        return stopped;
    }

    /**
     * Analyzes running tests and concludes those whose duration has elapsed. A failing test is reported
     * with action ERROR and does not stop the review of the others.
     *
     * @param campaignId restricts the review to one campaign; {@code null} reviews every running test
     */
    public List<AbTestReview> reviewRunningTests(String campaignId) {
        List<AbTest> running = campaignId == null
                ? store.findRunning()
                : store.findByCampaign(campaignId).stream().filter(test -> !test.status().isTerminal()).toList();
        List<AbTestReview> reviews = new ArrayList<>();
        for (AbTest test : running) {
            try {
                reviews.add(review(test));
            } catch (RuntimeException e) {
                log.error("Failed to review A/B test {}", test.testId(), e);
                reviews.add(new AbTestReview(test.testId(), test.campaignId(), AbTestReview.Action.ERROR,
                        test.status(), null, 0, e.getMessage()));
            }
        }
        return reviews;
    }

    private AbTestReview review(AbTest test) {
        AbTestResult result = analyze(test, OffsetDateTime.now(clock));
        if (result.status() == AbTestStatus.RUNNING) {
            return new AbTestReview(test.testId(), test.campaignId(), AbTestReview.Action.CONTINUE, result.status(),
                    result.winningVariantId(), result.confidence(), result.recommendations().get(0));
        }
        AbTest concluded = concludeTest(test.testId(), null);
        return new AbTestReview(test.testId(), test.campaignId(), AbTestReview.Action.CONCLUDE, concluded.status(),
                concluded.winningVariantId(), concluded.confidence() != null ? concluded.confidence() : 0,
                concluded.outcomeNote());
    }

    public List<AbTest> getActiveTests() {
        return store.findRunning();
    }

    public List<AbTest> getTestsForCampaign(String campaignId) {
        return store.findByCampaign(campaignId);
    }

    AbTestResult analyze(AbTest test, OffsetDateTime now) {
        Campaign campaign = dataStore.findCampaignById(test.campaignId())
                .orElseThrow(() -> new PermanentException("Campaign not found: " + test.campaignId()));
        if (!campaign.hasExternalId()) {
            throw new PermanentException("Campaign " + campaign.id() + " is not launched on " + campaign.platform());
        }
        PlatformAdapter adapter = adapters.adapterFor(campaign.platform());

        List<VariantResult> results = new ArrayList<>();
        for (AbTestVariant variant : test.variants()) {
            PlatformMetrics raw = adapter.getVariantMetrics(campaign.externalId(), test.testId(), variant.id());
            VariantMetrics metrics = VariantMetrics.from(raw);
            results.add(new VariantResult(variant.id(), variant.name(), variant.description(), metrics,
                    score(test.successMetric(), metrics), confidenceInterval(test.successMetric(), metrics)));
        }

        double improvement = improvement(results);
        boolean sampled = results.stream().allMatch(result -> result.metrics().impressions() > test.minimumSampleSize());
        boolean significant = results.size() >= 2 && improvement > settings.getSignificanceThreshold() && sampled;
        double confidence = results.size() < 2
                ? 0
                : Math.min(CONFIDENCE_CAP, significant ? 0.85 + improvement * 0.1 : 0.3 + improvement * 0.4);
        VariantResult best = best(results);
        String winner = significant && best != null ? best.variantId() : null;

        AbTestStatus status = AbTestStatus.RUNNING;
        if (test.elapsedDays(now) >= test.durationDays()) {
            status = significant ? AbTestStatus.COMPLETED : AbTestStatus.INCONCLUSIVE;
        }
        log.info("Analyzed A/B test {}: improvement {}, significant {}, confidence {}", test.testId(),
                format(improvement * 100, 1) + "%", significant, format(confidence, 2));
        return new AbTestResult(test.testId(), test.campaignId(), status, results, significant, improvement, confidence,
                winner, recommendations(test, results, significant, improvement, confidence, best), test.startedAt(),
                now);
    }

    static double score(SuccessMetric metric, VariantMetrics metrics) {
        double score = metric.score(metrics);
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score));
    }

    static VariantResult.ConfidenceInterval confidenceInterval(SuccessMetric metric, VariantMetrics metrics) {
        double value = metric.valueOf(metrics);
        double margin = value * 0.1;
        return new VariantResult.ConfidenceInterval(Math.max(0, value - margin), value + margin);
    }

    /**
     * Relative lead of the best score over the second best; 1.0 when the runner-up scores 0 and the best
     * does not.
     */
    static double improvement(List<VariantResult> results) {
        if (results.size() < 2) {
            return 0;
        }
        List<Double> scores = results.stream()
                .map(VariantResult::performanceScore)
                .sorted(Comparator.reverseOrder())
                .toList();
        double best = scores.get(0);
        double second = scores.get(1);
        if (second == 0) {
            return best > 0 ? 1.0 : 0;
        }
        return (best - second) / second;
    }

    private static VariantResult best(List<VariantResult> results) {
        VariantResult best = null;
        for (VariantResult result : results) {
            if (best == null || result.performanceScore() > best.performanceScore()) {
                best = result;
            }
        }
        return best;
    }

    private static List<String> recommendations(AbTest test, List<VariantResult> results, boolean significant,
            double improvement, double confidence, VariantResult best) {
        List<String> recommendations = new ArrayList<>();
        if (significant && best != null) {
            recommendations.add("Implement " + best.name() + " - shows " + format(best.performanceScore(), 1)
                    + " performance score");
            recommendations.add("Expected improvement: " + format(improvement * 100, 1) + "%");
            if (test.testType() == AbTestType.BUDGET) {
                recommendations.add("Apply winning budget allocation to similar campaigns");
            } else if (test.testType() == AbTestType.CREATIVE) {
                recommendations.add("Update creative assets based on winning variant");
            }
        } else {
            recommendations.add("Continue test for more statistical power");
            recommendations.add("Current confidence: " + format(confidence * 100, 1) + "% (need >85%)");
            recommendations.add("Consider increasing traffic allocation or extending test duration");
        }

        if (!results.isEmpty()) {
            double avgCtr = results.stream().mapToDouble(result -> result.metrics().ctr()).average().orElse(0);
            double avgRoas = results.stream().mapToDouble(result -> result.metrics().roas()).average().orElse(0);
            if (avgCtr < 1.5) {
                recommendations.add("All variants show low CTR - consider creative refresh");
            }
            if (avgRoas < 2.0) {
                recommendations.add("All variants show low ROAS - review targeting and pricing");
            }
        }
        return recommendations;
    }

    private static List<AbTestVariant> withMetrics(AbTest test, AbTestResult result) {
        List<AbTestVariant> updated = new ArrayList<>();
        for (AbTestVariant variant : test.variants()) {
            VariantMetrics metrics = result.results().stream()
                    .filter(variantResult -> variantResult.variantId().equals(variant.id()))
                    .map(VariantResult::metrics)
                    .findFirst()
                    .orElse(variant.lastMetrics());
            updated.add(variant.withMetrics(metrics));
        }
        return updated;
    }

    private void validate(AbTestSetup setup) {
        if (setup.campaignId() == null || setup.campaignId().isBlank()) {
            throw new ValidationException("campaignId is required");
        }
        if (setup.testType() == null || setup.successMetric() == null) {
            throw new ValidationException("testType and successMetric are required");
        }
        if (setup.variants() == null || setup.variants().size() < 2) {
            throw new ValidationException("An A/B test needs at least 2 variants");
        }
        if (setup.trafficSplit() == null || setup.trafficSplit().size() != setup.variants().size()) {
            throw new ValidationException("Traffic split must have one entry per variant");
        }
        if (setup.durationDays() < 1) {
            throw new ValidationException("durationDays must be >= 1");
        }
        if (setup.minimumSampleSize() != null && setup.minimumSampleSize() < 0) {
            throw new ValidationException("minimumSampleSize must be >= 0");
        }
        double total = 0;
        for (Double split : setup.trafficSplit()) {
            if (split == null || split < 0) {
                throw new ValidationException("Traffic split entries must be non-negative");
            }
            total += split;
        }
        if (Math.abs(total - 100) > SPLIT_TOLERANCE) {
            throw new ValidationException("Traffic split must add up to 100%, got " + formatSplit(total) + "%");
        }
    }

    private AbTest requireTest(String testId) {
        return store.findById(testId).orElseThrow(() -> new PermanentException("A/B test not found: " + testId));
    }

    private static String formatSplit(double total) {
        return total == Math.rint(total) ? String.valueOf((long) total) : String.valueOf(total);
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
