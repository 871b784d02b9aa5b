package com.adpilot.execution;

import com.adpilot.abtest.AbTest;
import com.adpilot.abtest.AbTestType;
import com.adpilot.abtest.AbTestVariant;
import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.marketing.BusinessAction;
import com.adpilot.marketing.BusinessDecision;
import com.adpilot.marketing.CampaignAction;
import com.adpilot.marketing.CampaignDecision;
import com.adpilot.port.BusinessStatus;
import com.adpilot.port.BusinessUpdate;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.CampaignUpdate;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.port.Notification;
import com.adpilot.port.NotificationChannel;
import com.adpilot.port.NotificationPriority;
import com.adpilot.port.NotificationType;
import com.adpilot.port.PlatformAdapter;
import com.adpilot.port.PlatformAdapterRegistry;
import com.adpilot.queue.JobClient;
import com.adpilot.queue.JobPayloads;
import com.adpilot.queue.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies business and campaign decisions through the platform adapters and the data store.
 * <p>
 * Campaign actions are applied one by one; a failing campaign is recorded as a FAILED result and does not
 * stop the others. OPTIMIZE is never run inline: it is handed to a {@code marketing:campaign:optimize} job.
 */
@Service
public class DecisionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DecisionExecutor.class);

    public static final String CLOSURE_REASON = "AI_AUTOMATED_CLOSURE_POOR_PERFORMANCE";
    static final String BUDGET_CONFIG_KEY = "budget";

    private final MarketingDataStore dataStore;
    private final PlatformAdapterRegistry adapters;
    private final JobClient jobClient;
    private final NotificationDispatcher notifications;
    private final AdPilotProperties.Decision settings;
    private final Clock clock;

    @Autowired
    public DecisionExecutor(MarketingDataStore dataStore, PlatformAdapterRegistry adapters, JobClient jobClient,
            NotificationDispatcher notifications, AdPilotProperties properties) {
        this(dataStore, adapters, jobClient, notifications, properties, Clock.systemUTC());
    }

    DecisionExecutor(MarketingDataStore dataStore, PlatformAdapterRegistry adapters, JobClient jobClient,
            NotificationDispatcher notifications, AdPilotProperties properties, Clock clock) {
        this.dataStore = dataStore;
        this.adapters = adapters;
        this.jobClient = jobClient;
        this.notifications = notifications;
        this.settings = properties.getDecision();
        this.clock = clock;
    }

    public List<ExecutionResult> execute(BusinessDecision decision) {
        log.info("Executing {} decision for business {} ({} campaign decision(s))", decision.decision(),
                decision.businessId(), decision.campaignDecisions().size());
        List<ExecutionResult> results = new ArrayList<>();
        for (CampaignDecision campaignDecision : decision.campaignDecisions()) {
            results.add(executeCampaign(campaignDecision));
        }

        if (decision.decision() == BusinessAction.CLOSE) {
            results.addAll(closeBusiness(decision));
        } else if (decision.decision() == BusinessAction.PAUSE) {
            results.addAll(pauseBusiness(decision.businessId()));
        }

        long failed = results.stream().filter(ExecutionResult::isFailed).count();
        if (failed > 0) {
            log.warn("Decision for business {} applied with {} failure(s)", decision.businessId(), failed);
        }
        return results;
    }

    ExecutionResult executeCampaign(CampaignDecision decision) {
        String campaignId = decision.campaignId();
        CampaignAction action = decision.action();
        try {
            return switch (action) {
                case SCALE -> {
                    double factor = decision.budgetChangeFactor() != null
                            ? decision.budgetChangeFactor()
                            : settings.getDefaultScaleFactor();
                    BigDecimal budget = scaleCampaign(campaignId, factor);
                    yield ExecutionResult.succeeded(campaignId, action.name(), "Budget set to " + budget);
                }
                case PAUSE -> {
                    pauseCampaign(campaignId);
                    yield ExecutionResult.succeeded(campaignId, action.name(), "Campaign paused");
                }
                case OPTIMIZE -> {
                    UUID jobId = jobClient.enqueue(JobType.CAMPAIGN_OPTIMIZE,
                            new JobPayloads.CampaignOptimize(campaignId, String.join("; ", decision.reasons())));
                    yield ExecutionResult.succeeded(campaignId, action.name(), "Optimization job " + jobId);
                }
                case MAINTAIN -> ExecutionResult.skipped(campaignId, action.name(), "No change required");
            };
        } catch (RuntimeException e) {
            log.error("Failed to apply {} to campaign {}", action, campaignId, e);
            return ExecutionResult.failed(campaignId, action.name(), e.getMessage());
        }
    }

    /**
     * Multiplies the campaign budget by {@code factor} on its platform and in the store.
     *
     * @return the new budget
     */
    public BigDecimal scaleCampaign(String campaignId, double factor) {
        if (!(factor > 0)) {
            throw new IllegalArgumentException("Budget factor must be positive, got " + factor);
        }
        Campaign campaign = requireCampaign(campaignId);
        BigDecimal current = campaign.budget() != null ? campaign.budget() : BigDecimal.ZERO;
        BigDecimal budget = current.multiply(BigDecimal.valueOf(factor)).setScale(2, RoundingMode.HALF_UP);
        if (campaign.hasExternalId()) {
            adapters.adapterFor(campaign.platform()).updateBudget(campaign.externalId(), budget);
        }
        dataStore.updateCampaign(campaignId, CampaignUpdate.budget(budget));
        log.info("Scaled campaign {} budget {} -> {} (x{})", campaignId, current, budget, factor);
        return budget;
    }

    public void pauseCampaign(String campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        if (campaign.hasExternalId()) {
            adapters.adapterFor(campaign.platform()).pause(campaign.externalId());
        }
        dataStore.updateCampaign(campaignId, CampaignUpdate.status(CampaignStatus.PAUSED));
        log.info("Paused campaign {}", campaignId);
    }

    /**
     * Pauses every still active campaign of the business, isolating failures per campaign.
     */
    public List<ExecutionResult> pauseAllCampaigns(String businessId) {
        List<ExecutionResult> results = new ArrayList<>();
        for (Campaign campaign : dataStore.findCampaignsByBusiness(businessId, CampaignStatus.ACTIVE)) {
            if (campaign.status() != CampaignStatus.ACTIVE) {
                continue;
            }
            try {
                pauseCampaign(campaign.id());
                results.add(ExecutionResult.succeeded(campaign.id(), CampaignAction.PAUSE.name(), "Campaign paused"));
            } catch (RuntimeException e) {
                log.error("Failed to pause campaign {} of business {}", campaign.id(), businessId, e);
                results.add(ExecutionResult.failed(campaign.id(), CampaignAction.PAUSE.name(), e.getMessage()));
            }
        }
        return results;
    }

    List<ExecutionResult> closeBusiness(BusinessDecision decision) {
        String businessId = decision.businessId();
        log.warn("Closing business {}: {}", businessId, decision.reasons());
        List<ExecutionResult> results = new ArrayList<>(pauseAllCampaigns(businessId));
        try {
            dataStore.updateBusiness(businessId, BusinessUpdate.closed(CLOSURE_REASON, OffsetDateTime.now(clock)));
            results.add(ExecutionResult.succeeded(null, BusinessAction.CLOSE.name(), "Business closed"));
        } catch (RuntimeException e) {
            log.error("Failed to close business {}", businessId, e);
            results.add(ExecutionResult.failed(null, BusinessAction.CLOSE.name(), e.getMessage()));
            return results;
        }
        notifications.dispatch(new Notification(
                NotificationType.BUSINESS_ALERT,
                NotificationPriority.CRITICAL,
                businessId,
                "Business " + decision.businessName() + " closed after sustained poor performance",
                Map.of("reasons", decision.reasons(), "closureReason", CLOSURE_REASON),
                EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.SLACK),
                null,
                OffsetDateTime.now(clock)));
        return results;
    }

    List<ExecutionResult> pauseBusiness(String businessId) {
        List<ExecutionResult> results = new ArrayList<>(pauseAllCampaigns(businessId));
        try {
            dataStore.updateBusiness(businessId, BusinessUpdate.status(BusinessStatus.PAUSED));
            results.add(ExecutionResult.succeeded(null, BusinessAction.PAUSE.name(), "Business paused"));
        } catch (RuntimeException e) {
            log.error("Failed to pause business {}", businessId, e);
            results.add(ExecutionResult.failed(null, BusinessAction.PAUSE.name(), e.getMessage()));
        }
        return results;
    }

    /**
     * Rolls out the winning variant of a test: a budget test with a {@code budget} entry sets the campaign
     * budget, any other test pushes the variant configuration to the platform.
     */
    public void applyVariant(AbTest test, AbTestVariant variant) {
        Campaign campaign = requireCampaign(test.campaignId());
        Object budgetValue = variant.config().get(BUDGET_CONFIG_KEY);
        if (test.testType() == AbTestType.BUDGET && budgetValue != null) {
            BigDecimal budget = new BigDecimal(budgetValue.toString()).setScale(2, RoundingMode.HALF_UP);
            if (campaign.hasExternalId()) {
                adapters.adapterFor(campaign.platform()).updateBudget(campaign.externalId(), budget);
            }
            dataStore.updateCampaign(campaign.id(), CampaignUpdate.budget(budget));
            log.info("Applied budget {} of variant {} to campaign {}", budget, variant.id(), campaign.id());
            return;
        }
        if (!campaign.hasExternalId()) {
            throw new PermanentException("Campaign " + campaign.id() + " is not launched on " + campaign.platform());
        }
        PlatformAdapter adapter = adapters.adapterFor(campaign.platform());
        adapter.applyConfiguration(campaign.externalId(), variant.config());
        log.info("Applied configuration of variant {} to campaign {}", variant.id(), campaign.id());
    }

    private Campaign requireCampaign(String campaignId) {
        return dataStore.findCampaignById(campaignId)
                .orElseThrow(() -> new PermanentException("Campaign not found: " + campaignId));
    }
}
