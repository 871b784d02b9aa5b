package com.adpilot.queue;

import com.adpilot.port.AdPlatform;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Payload shapes of the job kinds in {@link JobType}. Payloads are serialized to the job row as JSON
 * and read back into these records before a handler sees them.
 */
public final class JobPayloads {

    private JobPayloads() {
    }

    public record BusinessCreation(
            String userId,
            String businessIdea,
            boolean aiResearch,
            String targetMarket,
            String businessModel) {
    }

    public record BusinessDeployment(
            String businessId,
            String templateId,
            String domain) {
    }

    public record DeploymentHealthCheck(
            String businessId,
            String deploymentId,
            String url) {
    }

    public record CampaignCreate(
            String businessId,
            AdPlatform platform,
            String targetAudience,
            BigDecimal dailyBudget,
            int durationDays,
            List<String> keywords) {
    }

    /**
     * Monitors one campaign when {@code campaignId} is set, all active campaigns of a business when only
     * {@code businessId} is set, and every active business otherwise.
     */
    public record CampaignMonitor(
            String businessId,
            String campaignId) {
    }

    public record CampaignOptimize(
            String campaignId,
            String reason) {
    }

    public record MarketingAutomation(
            AnalysisScope analysisScope,
            List<String> targetBusinessIds,
            Integer evaluationPeriodDays,
            boolean enableAbTesting,
            NotificationSettings notificationSettings) {

        public enum AnalysisScope {
            ALL_BUSINESSES,
            SPECIFIC_BUSINESSES
        }

        public record NotificationSettings(boolean email, boolean slack, String webhookUrl) {
        }

        public static MarketingAutomation allBusinesses() {
            return new MarketingAutomation(AnalysisScope.ALL_BUSINESSES, List.of(), null, true,
                    new NotificationSettings(true, false, null));
        }
    }

    public record Analytics(
            String businessId,
            String dataSource,
            LocalDate from,
            LocalDate to,
            List<String> metrics,
            String reportType) {
    }

    public record Payment(
            String paymentIntentId,
            BigDecimal amount,
            String currency,
            String customerId,
            String subscriptionId,
            int retryCount) {
    }

    public record PaymentWebhook(
            String eventId,
            String eventType,
            Map<String, Object> data) {
    }

    public record SystemTask(String trigger) {

        public static SystemTask scheduled() {
            return new SystemTask("scheduler");
        }
    }

    public record PerformanceMonitoring(
            String businessId,
            String url) {
    }

    /**
     * Evaluates every running test, or only the tests of {@code campaignId} when set.
     */
    public record AbTestEvaluation(String campaignId) {
    }
}
