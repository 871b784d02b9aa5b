package com.adpilot.worker;

import com.adpilot.abtest.AbTestReview;
import com.adpilot.abtest.AbTestingEngine;
import com.adpilot.config.AdPilotProperties;
import com.adpilot.execution.DecisionExecutor;
import com.adpilot.execution.ExecutionResult;
import com.adpilot.execution.NotificationDispatcher;
import com.adpilot.marketing.BusinessAction;
import com.adpilot.marketing.BusinessDecision;
import com.adpilot.marketing.BusinessDecisionEngine;
import com.adpilot.marketing.CampaignDecision;
import com.adpilot.port.Business;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.port.Notification;
import com.adpilot.port.NotificationChannel;
import com.adpilot.port.NotificationPriority;
import com.adpilot.port.NotificationType;
import com.adpilot.queue.JobPayloads.MarketingAutomation;
import com.adpilot.queue.JobPayloads.MarketingAutomation.AnalysisScope;
import com.adpilot.queue.JobPayloads.MarketingAutomation.NotificationSettings;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Daily marketing workflow: evaluates every business in scope, applies the decisions, reviews the running
 * A/B tests of the evaluated campaigns and notifies about the decisions that need attention.
 * <p>
 * A business that cannot be evaluated is logged and skipped. Once decisions have been applied the job always
 * completes: A/B review and notification failures are logged and recorded in the report, never retried.
 */
@Component
@Job(JobType.MARKETING_AUTOMATION)
public class MarketingAutomationWorker implements JobWorker<MarketingAutomation> {

    private static final Logger log = LoggerFactory.getLogger(MarketingAutomationWorker.class);

    private final MarketingDataStore dataStore;
    private final BusinessDecisionEngine decisionEngine;
    private final DecisionExecutor executor;
    private final AbTestingEngine abTestingEngine;
    private final NotificationDispatcher notifications;
    private final AdPilotProperties properties;

    public MarketingAutomationWorker(MarketingDataStore dataStore, BusinessDecisionEngine decisionEngine,
            DecisionExecutor executor, AbTestingEngine abTestingEngine, NotificationDispatcher notifications,
            AdPilotProperties properties) {
        this.dataStore = dataStore;
        this.decisionEngine = decisionEngine;
        this.executor = executor;
        this.abTestingEngine = abTestingEngine;
        this.notifications = notifications;
        this.properties = properties;
    }

    @Override
    public JobResult process(UUID jobId, MarketingAutomation payload) {
        int window = payload.evaluationPeriodDays() != null && payload.evaluationPeriodDays() > 0
                ? payload.evaluationPeriodDays()
                : properties.getDecision().getAnalysisWindowDays();
        List<Business> businesses = businessesInScope(payload);
        log.info("Marketing automation {} analyzing {} business(es) over {} days", jobId, businesses.size(), window);

        List<BusinessDecision> decisions = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (Business business : businesses) {
            try {
                decisions.add(decisionEngine.evaluate(business.id(), window));
            } catch (RuntimeException e) {
                log.error("Error analyzing business {}", business.id(), e);
                failed.put(business.id(), e.getMessage());
            }
        }

        Map<String, List<ExecutionResult>> executions = new LinkedHashMap<>();
        for (BusinessDecision decision : decisions) {
            try {
                executions.put(decision.businessId(), executor.execute(decision));
            } catch (RuntimeException e) {
                log.error("Error executing decision for business {}", decision.businessId(), e);
                executions.put(decision.businessId(),
                        List.of(ExecutionResult.failed(null, decision.decision().name(), e.getMessage())));
            }
        }

        Map<String, String> abTestErrors = new LinkedHashMap<>();
        List<AbTestReview> abTests = payload.enableAbTesting() ? reviewAbTests(decisions, abTestErrors) : List.of();

        if (payload.notificationSettings() != null) {
            try {
                sendNotifications(decisions, payload.notificationSettings());
            } catch (RuntimeException e) {
                log.error("Error sending marketing decision notifications", e);
            }
        }

        ExecutiveSummary summary = ExecutiveSummary.of(decisions);
        log.info("Marketing automation {} completed: {} decision(s), {} failure(s), {} A/B test(s) reviewed", jobId,
                decisions.size(), failed.size(), abTests.size());
        return JobResult.success(new AutomationReport(businesses.size(), decisions, executions, abTests,
                abTestErrors, failed, summary));
    }

    private List<Business> businessesInScope(MarketingAutomation payload) {
        if (payload.analysisScope() == AnalysisScope.SPECIFIC_BUSINESSES && payload.targetBusinessIds() != null) {
            List<Business> businesses = new ArrayList<>();
            for (String businessId : payload.targetBusinessIds()) {
                dataStore.findBusinessById(businessId).ifPresentOrElse(businesses::add,
                        () -> log.warn("Business {} not found, skipping", businessId));
            }
            return businesses;
        }
        return dataStore.findActiveBusinesses(false);
    }

    private List<AbTestReview> reviewAbTests(List<BusinessDecision> decisions, Map<String, String> errors) {
        List<AbTestReview> reviews = new ArrayList<>();
        for (BusinessDecision decision : decisions) {
            for (CampaignDecision campaign : decision.campaignDecisions()) {
                try {
                    reviews.addAll(abTestingEngine.reviewRunningTests(campaign.campaignId()));
                } catch (RuntimeException e) {
                    log.error("Error reviewing A/B tests of campaign {}", campaign.campaignId(), e);
                    errors.put(campaign.campaignId(), e.getMessage());
                }
            }
        }
        return reviews;
    }

    void sendNotifications(List<BusinessDecision> decisions, NotificationSettings settings) {
        Set<NotificationChannel> channels = channels(settings);
        int sent = 0;
        for (BusinessDecision decision : decisions) {
            if (!shouldNotify(decision)) {
                continue;
            }
            notifications.dispatch(new Notification(
                    NotificationType.MARKETING_DECISION,
                    priorityFor(decision),
                    decision.businessId(),
                    summaryFor(decision),
                    Map.of("decision", decision.decision().name(),
                            "confidence", decision.confidence(),
                            "reasons", decision.reasons()),
                    channels,
                    settings.webhookUrl(),
                    OffsetDateTime.now()));
            sent++;
        }
        if (sent == 0) {
            log.info("No high-priority marketing decisions to notify");
        }
    }

    static boolean shouldNotify(BusinessDecision decision) {
        return decision.decision() == BusinessAction.CLOSE
                || decision.decision() == BusinessAction.SCALE
                || decision.confidence() < 0.6;
    }

    static NotificationPriority priorityFor(BusinessDecision decision) {
        if (decision.decision() == BusinessAction.CLOSE) {
            return NotificationPriority.CRITICAL;
        }
        if (decision.decision() == BusinessAction.PAUSE || decision.confidence() < 0.5) {
            return NotificationPriority.HIGH;
        }
        if (decision.decision() == BusinessAction.SCALE) {
            return NotificationPriority.MEDIUM;
        }
        return NotificationPriority.LOW;
    }

    static String summaryFor(BusinessDecision decision) {
        return decision.decision() + " decision for " + decision.businessName() + " ("
                + String.format(Locale.ROOT, "%.0f", decision.confidence() * 100) + "% confidence)";
    }

    private static Set<NotificationChannel> channels(NotificationSettings settings) {
        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        if (settings.email()) {
            channels.add(NotificationChannel.EMAIL);
        }
        if (settings.slack()) {
            channels.add(NotificationChannel.SLACK);
        }
        if (settings.webhookUrl() != null && !settings.webhookUrl().isBlank()) {
            channels.add(NotificationChannel.WEBHOOK);
        }
        return channels;
    }
}
