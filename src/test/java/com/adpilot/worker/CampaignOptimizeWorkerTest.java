package com.adpilot.worker;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.PermanentException;
import com.adpilot.execution.DecisionExecutor;
import com.adpilot.marketing.CampaignAction;
import com.adpilot.marketing.CampaignDecision;
import com.adpilot.marketing.CampaignPerformanceAnalyzer;
import com.adpilot.marketing.CampaignPerformanceRecord;
import com.adpilot.port.AdPlatform;
import com.adpilot.port.Business;
import com.adpilot.port.BusinessStatus;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.DateRange;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.queue.JobPayloads.CampaignOptimize;
import com.adpilot.queue.JobResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CampaignOptimizeWorkerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T12:00:00Z");

    private MarketingDataStore dataStore;
    private CampaignPerformanceAnalyzer analyzer;
    private DecisionExecutor executor;
    private CampaignOptimizeWorker worker;
    private Business business;

    @BeforeEach
    void setUp() {
        dataStore = mock(MarketingDataStore.class);
        analyzer = mock(CampaignPerformanceAnalyzer.class);
        executor = mock(DecisionExecutor.class);
        worker = new CampaignOptimizeWorker(dataStore, analyzer, executor, new AdPilotProperties());
        business = new Business("b1", "Acme", "owner-1", BusinessStatus.ACTIVE, new BigDecimal("100"), null,
                NOW.minusDays(30), null);
        when(dataStore.findBusinessById("b1")).thenReturn(Optional.of(business));
    }

    @Test
    void shouldScaleUpStrongCampaign() {
        Campaign campaign = stubCampaign("c1", CampaignStatus.ACTIVE);
        when(analyzer.analyzeCampaign(business, campaign, 14)).thenReturn(analysis(campaign, CampaignAction.SCALE));

        JobResult result = worker.process(UUID.randomUUID(), new CampaignOptimize("c1", "scheduled"));

        verify(executor).scaleCampaign("c1", 1.2);
        CampaignOptimization optimization = (CampaignOptimization) result.getData();
        assertThat(optimization.recommendation()).isEqualTo(CampaignAction.SCALE);
        assertThat(optimization.optimizations()).singleElement().satisfies(step -> {
            assertThat(step.type()).isEqualTo(OptimizationAction.BUDGET_INCREASE);
            assertThat(step.description())
                    .isEqualTo("Budget increased by 20% due to strong performance (ROAS: 3.50)");
        });
        assertThat(optimization.expectedImpact())
                .isEqualTo("Expected 15-25% increase in conversions with current ROAS of 3.50");
    }

    @Test
    void shouldReduceBudgetAndQueueKeywordWorkForOptimizeRecommendation() {
        Campaign campaign = stubCampaign("c1", CampaignStatus.ACTIVE);
        when(analyzer.analyzeCampaign(business, campaign, 14))
                .thenReturn(analysis(campaign, CampaignAction.OPTIMIZE));

        CampaignOptimization optimization = worker.optimize(campaign);

        verify(executor).scaleCampaign("c1", 0.9);
        assertThat(optimization.optimizations()).extracting(CampaignOptimization.Step::type)
                .containsExactly(OptimizationAction.BUDGET_DECREASE, OptimizationAction.KEYWORD_OPTIMIZATION);
    }

    @Test
    void shouldPausePoorCampaignAndOnlyAdjustBidsForStableOne() {
        Campaign poor = stubCampaign("c1", CampaignStatus.ACTIVE);
        Campaign stable = stubCampaign("c2", CampaignStatus.ACTIVE);
        when(analyzer.analyzeCampaign(business, poor, 14)).thenReturn(analysis(poor, CampaignAction.PAUSE));
        when(analyzer.analyzeCampaign(business, stable, 14)).thenReturn(analysis(stable, CampaignAction.MAINTAIN));

        CampaignOptimization paused = worker.optimize(poor);
        CampaignOptimization maintained = worker.optimize(stable);

        verify(executor).pauseCampaign("c1");
        assertThat(paused.optimizations().get(0).description())
                .isEqualTo("Campaign paused due to poor performance (Score: 40/100)");
        assertThat(maintained.optimizations()).extracting(CampaignOptimization.Step::type)
                .containsExactly(OptimizationAction.BID_ADJUSTMENT);
        verify(executor, never()).scaleCampaign(any(), anyDouble());
    }

    @Test
    void shouldSkipCampaignThatIsNoLongerActive() {
        stubCampaign("c1", CampaignStatus.PAUSED);

        JobResult result = worker.process(UUID.randomUUID(), new CampaignOptimize("c1", "scheduled"));

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUCCEEDED);
        verifyNoInteractions(analyzer, executor);
    }

    @Test
    void shouldFailPermanentlyForUnknownCampaign() {
        when(dataStore.findCampaignById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> worker.process(UUID.randomUUID(), new CampaignOptimize("missing", "scheduled")))
                .isInstanceOf(PermanentException.class)
                .hasMessage("Campaign not found: missing");
    }

    @Test
    void shouldOptimizeAllActiveCampaignsAndReportFailures() {
        Campaign ok = stubCampaign("c1", CampaignStatus.ACTIVE);
        Campaign broken = stubCampaign("c2", CampaignStatus.ACTIVE);
        when(dataStore.findActiveBusinesses(false)).thenReturn(List.of(business));
        when(dataStore.findCampaignsByBusiness("b1", CampaignStatus.ACTIVE)).thenReturn(List.of(ok, broken));
        when(analyzer.analyzeCampaign(business, ok, 14)).thenReturn(analysis(ok, CampaignAction.MAINTAIN));
        when(analyzer.analyzeCampaign(business, broken, 14)).thenThrow(new IllegalStateException("api quota"));

        JobResult result = worker.process(UUID.randomUUID(), new CampaignOptimize(null, "scheduled optimization"));

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUCCEEDED);
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertThat((List<?>) data.get("optimized")).hasSize(1);
        assertThat(data.get("failures")).isEqualTo(Map.of("c2", "api quota"));
    }

    @Test
    void shouldAskForRetryWhenEveryCampaignFails() {
        Campaign broken = stubCampaign("c1", CampaignStatus.ACTIVE);
        when(dataStore.findActiveBusinesses(false)).thenReturn(List.of(business));
        when(dataStore.findCampaignsByBusiness("b1", CampaignStatus.ACTIVE)).thenReturn(List.of(broken));
        when(analyzer.analyzeCampaign(business, broken, 14)).thenThrow(new IllegalStateException("api quota"));

        JobResult result = worker.process(UUID.randomUUID(), new CampaignOptimize(null, "scheduled optimization"));

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.RETRY);
        assertThat(result.getMessage()).isEqualTo("Optimization failed for all 1 campaign(s)");
    }

    private Campaign stubCampaign(String id, CampaignStatus status) {
        Campaign campaign = new Campaign(id, "b1", "Campaign " + id, AdPlatform.GOOGLE_ADS, status, "ext-" + id,
                new BigDecimal("100.00"), BigDecimal.ZERO, 0, 0, 0, NOW.minusDays(20));
        when(dataStore.findCampaignById(id)).thenReturn(Optional.of(campaign));
        return campaign;
    }

    private static CampaignDecision analysis(Campaign campaign, CampaignAction action) {
        CampaignPerformanceRecord record = new CampaignPerformanceRecord(campaign.id(),
                DateRange.lastDays(14, LocalDate.of(2026, 3, 1)), 10_000, 100, 5, 500, 1750, 1.0, 5.0, 100, 3.5,
                40, 20);
        return new CampaignDecision(campaign.id(), campaign.name(), campaign.platform(), action, null,
                List.of("test"), record);
    }
}
