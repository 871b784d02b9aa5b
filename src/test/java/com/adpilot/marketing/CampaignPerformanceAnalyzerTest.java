package com.adpilot.marketing;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.ConfigurationException;
import com.adpilot.port.AdPlatform;
import com.adpilot.port.Business;
import com.adpilot.port.BusinessStatus;
import com.adpilot.port.Campaign;
import com.adpilot.port.CampaignStatus;
import com.adpilot.port.DateRange;
import com.adpilot.port.PlatformAdapter;
import com.adpilot.port.PlatformAdapterRegistry;
import com.adpilot.port.PlatformMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CampaignPerformanceAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final DateRange WINDOW = DateRange.lastDays(14, LocalDate.of(2026, 3, 1));

    private PlatformAdapter googleAds;
    private CampaignPerformanceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        googleAds = mock(PlatformAdapter.class);
        when(googleAds.platform()).thenReturn(AdPlatform.GOOGLE_ADS);
        analyzer = new CampaignPerformanceAnalyzer(new PlatformAdapterRegistry(List.of(googleAds)),
                new AdPilotProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldScoreZeroForCampaignWithoutTraffic() {
        CampaignPerformanceRecord record = analyzer.measure("c1", WINDOW,
                new PlatformMetrics(0, 0, 0, BigDecimal.ZERO), 100, 50, 3);

        assertThat(record.performanceScore()).isZero();
        assertThat(record.ctr()).isZero();
        assertThat(record.cpc()).isZero();
        assertThat(record.costPerConversion()).isZero();
        assertThat(record.roas()).isZero();
    }

    @Test
    void shouldDeriveRatiosFromRawMetrics() {
        CampaignPerformanceRecord record = analyzer.measure("c1", WINDOW,
                new PlatformMetrics(10_000, 300, 20, new BigDecimal("1000")), 200, 50, 30);

        assertThat(record.ctr()).isCloseTo(3.0, within(1e-9));
        assertThat(record.cpc()).isCloseTo(3.333, within(0.001));
        assertThat(record.costPerConversion()).isCloseTo(50.0, within(1e-9));
        assertThat(record.revenue()).isCloseTo(4000.0, within(1e-9));
        assertThat(record.roas()).isCloseTo(4.0, within(1e-9));
        assertThat(record.performanceScore()).isEqualTo(100);
    }

    @Test
    void shouldWeightScoreComponents() {
        // ctr 1% -> 50, roas 1.5 -> 50, 5 conversions -> 50, cpa at twice the target -> 50
        assertThat(CampaignPerformanceAnalyzer.performanceScore(1.0, 1.5, 5, 100, 50)).isEqualTo(50);
        assertThat(CampaignPerformanceAnalyzer.performanceScore(50.0, 40.0, 500, 1, 50)).isEqualTo(100);
        assertThat(CampaignPerformanceAnalyzer.performanceScore(-1.0, -2.0, 0, 0, 50)).isZero();
    }

    @Test
    void shouldScaleMatureTopPerformerByThirtyPercent() {
        CampaignDecision decision = recommend(10_000, 300, 20, "1000", 200, 30);

        assertThat(decision.action()).isEqualTo(CampaignAction.SCALE);
        assertThat(decision.budgetChangeFactor()).isEqualTo(1.3);
        assertThat(decision.reasons()).containsExactly("Excellent performance score: 100/100", "Strong ROAS: 4.00");
    }

    @Test
    void shouldScaleGoodMatureCampaignModerately() {
        CampaignDecision decision = recommend(10_000, 100, 10, "400", 100, 30);

        assertThat(decision.performance().performanceScore()).isEqualTo(78);
        assertThat(decision.action()).isEqualTo(CampaignAction.SCALE);
        assertThat(decision.budgetChangeFactor()).isEqualTo(1.15);
    }

    @Test
    void shouldPauseCampaignUnderperformingForTwoWeeks() {
        CampaignDecision decision = recommend(10_000, 50, 1, "500", 100, 20);

        assertThat(decision.performance().performanceScore()).isEqualTo(13);
        assertThat(decision.action()).isEqualTo(CampaignAction.PAUSE);
        assertThat(decision.budgetChangeFactor()).isNull();
        assertThat(decision.reasons()).contains("Campaign underperforming for 2+ weeks");
    }

    @Test
    void shouldOptimizeUnderperformerYoungerThanTwoWeeks() {
        CampaignDecision decision = recommend(10_000, 50, 1, "500", 100, 10);

        assertThat(decision.action()).isEqualTo(CampaignAction.OPTIMIZE);
        assertThat(decision.reasons()).contains("Requires optimization");
    }

    @Test
    void shouldTreatFirstWeekAsLearningPhase() {
        assertThat(recommend(10_000, 50, 1, "500", 100, 3).action()).isEqualTo(CampaignAction.OPTIMIZE);
        CampaignDecision strong = recommend(10_000, 300, 20, "1000", 200, 3);
        assertThat(strong.action()).isEqualTo(CampaignAction.SCALE);
        assertThat(strong.budgetChangeFactor()).isEqualTo(1.2);

        // ctr 1% -> 50, roas 1.5 -> 50, 5 conversions -> 50, cpa 100 vs 50 -> 50
        CampaignDecision learning = recommend(10_000, 100, 5, "500", 150, 5);
        assertThat(learning.performance().performanceScore()).isEqualTo(50);
        assertThat(learning.action()).isEqualTo(CampaignAction.MAINTAIN);
        assertThat(learning.reasons()).containsExactly("Campaign in learning phase");
    }

    @Test
    void shouldMaintainMatureCampaignInAcceptableRange() {
        CampaignDecision decision = recommend(10_000, 100, 5, "500", 150, 30);

        assertThat(decision.action()).isEqualTo(CampaignAction.MAINTAIN);
        assertThat(CampaignPerformanceAnalyzer.expectedImpact(decision))
                .isEqualTo("Steady performance expected with minor efficiency improvements");
    }

    @Test
    void shouldFetchMetricsFromPlatformForLaunchedCampaign() {
        when(googleAds.getMetrics(eq("ext-1"), any(DateRange.class)))
                .thenReturn(new PlatformMetrics(10_000, 300, 20, new BigDecimal("1000")));
        Campaign campaign = campaign("ext-1", 30);

        CampaignDecision decision = analyzer.analyzeCampaign(business(), campaign, 7);

        ArgumentCaptor<DateRange> window = ArgumentCaptor.forClass(DateRange.class);
        verify(googleAds).getMetrics(eq("ext-1"), window.capture());
        assertThat(window.getValue()).isEqualTo(DateRange.lastDays(7, LocalDate.of(2026, 3, 1)));
        assertThat(decision.action()).isEqualTo(CampaignAction.SCALE);
        assertThat(decision.performance().ageDays()).isEqualTo(30);
    }

    @Test
    void shouldUseStoredCountersForCampaignWithoutExternalId() {
        Campaign campaign = campaign(null, 30);

        CampaignDecision decision = analyzer.analyzeCampaign(business(), campaign, 14);

        verify(googleAds, never()).getMetrics(any(), any());
        assertThat(decision.performance().impressions()).isEqualTo(5_000);
        assertThat(decision.performance().clicks()).isEqualTo(100);
    }

    @Test
    void shouldFailWhenPlatformHasNoAdapter() {
        Campaign campaign = new Campaign("c9", "b1", "LinkedIn", AdPlatform.LINKEDIN_ADS, CampaignStatus.ACTIVE,
                "li-1", new BigDecimal("100"), BigDecimal.ZERO, 0, 0, 0, null);

        assertThatThrownBy(() -> analyzer.analyzeCampaign(business(), campaign, 14))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("No platform adapter configured for LINKEDIN_ADS");
    }

    @Test
    void shouldDescribeExpectedImpactPerAction() {
        CampaignDecision scale = recommend(10_000, 300, 20, "1000", 200, 30);
        CampaignDecision pause = recommend(10_000, 50, 1, "500", 100, 20);

        assertThat(CampaignPerformanceAnalyzer.expectedImpact(scale))
                .isEqualTo("Expected 15-25% increase in conversions with current ROAS of 4.00");
        assertThat(CampaignPerformanceAnalyzer.expectedImpact(pause))
                .isEqualTo("Campaign costs eliminated, traffic redirected to better performing channels");
    }

    private CampaignDecision recommend(long impressions, long clicks, long conversions, String cost,
            double monthlyPrice, long ageDays) {
        CampaignPerformanceRecord record = analyzer.measure("c1", WINDOW,
                new PlatformMetrics(impressions, clicks, conversions, new BigDecimal(cost)), monthlyPrice, 50, ageDays);
        return analyzer.recommend(campaign("ext-1", ageDays), record);
    }

    private static Campaign campaign(String externalId, long ageDays) {
        OffsetDateTime start = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(ageDays);
        return new Campaign("c1", "b1", "Search", AdPlatform.GOOGLE_ADS, CampaignStatus.ACTIVE, externalId,
                new BigDecimal("100"), new BigDecimal("200"), 5_000, 100, 4, start);
    }

    private static Business business() {
        return new Business("b1", "Acme", "owner-1", BusinessStatus.ACTIVE, new BigDecimal("200"), null,
                OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(40), null);
    }
}
