package com.adpilot.queue;

import com.adpilot.error.ValidationException;

/**
 * Closed set of job kinds. Each kind carries its wire code, payload shape, worker pool size and the
 * retry defaults of the queue family it belongs to.
 */
public enum JobType {

    BUSINESS_CREATION("business:creation", JobPayloads.BusinessCreation.class, QueueFamily.BUSINESS, 1),
    BUSINESS_DEPLOYMENT("business:deployment", JobPayloads.BusinessDeployment.class, QueueFamily.BUSINESS, 1),
    DEPLOYMENT_HEALTH_CHECK("deployment:health-check", JobPayloads.DeploymentHealthCheck.class,
            QueueFamily.BUSINESS, 2),
    CAMPAIGN_CREATE("marketing:campaign:create", JobPayloads.CampaignCreate.class, QueueFamily.MARKETING, 3),
    CAMPAIGN_MONITOR("marketing:campaign:monitor", JobPayloads.CampaignMonitor.class, QueueFamily.MARKETING, 5),
    CAMPAIGN_OPTIMIZE("marketing:campaign:optimize", JobPayloads.CampaignOptimize.class, QueueFamily.MARKETING, 2),
    MARKETING_AUTOMATION("marketing:automation", JobPayloads.MarketingAutomation.class, QueueFamily.MARKETING, 1),
    ANALYTICS_COLLECT("analytics:collect", JobPayloads.Analytics.class, QueueFamily.ANALYTICS, 2),
    ANALYTICS_PROCESS("analytics:process", JobPayloads.Analytics.class, QueueFamily.ANALYTICS, 1),
    ANALYTICS_REPORT("analytics:report", JobPayloads.Analytics.class, QueueFamily.ANALYTICS, 1),
    PAYMENT_PROCESS("payment:process", JobPayloads.Payment.class, QueueFamily.PAYMENT, 5),
    PAYMENT_RETRY("payment:retry", JobPayloads.Payment.class, QueueFamily.PAYMENT, 3),
    PAYMENT_WEBHOOK("payment:webhook", JobPayloads.PaymentWebhook.class, QueueFamily.PAYMENT, 10),
    SYSTEM_CLEANUP("system:cleanup", JobPayloads.SystemTask.class, QueueFamily.SYSTEM, 1),
    SYSTEM_BACKUP("system:backup", JobPayloads.SystemTask.class, QueueFamily.SYSTEM, 1),
    SYSTEM_HEALTH("system:health", JobPayloads.SystemTask.class, QueueFamily.SYSTEM, 1),
    PERFORMANCE_MONITORING("monitoring:performance", JobPayloads.PerformanceMonitoring.class,
            QueueFamily.SYSTEM, 1),
    AB_TEST_EVALUATION("abtest:evaluate", JobPayloads.AbTestEvaluation.class, QueueFamily.MARKETING, 1);

    /**
     * Retry and priority defaults shared by related job kinds.
     */
    public enum QueueFamily {
        BUSINESS(3, BackoffPolicy.exponential(2000), JobPriority.NORMAL),
        MARKETING(5, BackoffPolicy.exponential(5000), JobPriority.NORMAL),
        ANALYTICS(3, BackoffPolicy.fixed(10000), JobPriority.NORMAL),
        PAYMENT(5, BackoffPolicy.exponential(1000), JobPriority.HIGH),
        SYSTEM(2, BackoffPolicy.fixed(30000), JobPriority.NORMAL);

        private final int maxAttempts;
        private final BackoffPolicy backoff;
        private final JobPriority priority;

        QueueFamily(int maxAttempts, BackoffPolicy backoff, JobPriority priority) {
            this.maxAttempts = maxAttempts;
            this.backoff = backoff;
            this.priority = priority;
        }

        public int maxAttempts() {
            return maxAttempts;
        }

        public BackoffPolicy backoff() {
            return backoff;
        }

        public JobPriority priority() {
            return priority;
        }
    }

    private final String code;
    private final Class<?> payloadClass;
    private final QueueFamily family;
    private final int defaultConcurrency;

    JobType(String code, Class<?> payloadClass, QueueFamily family, int defaultConcurrency) {
        this.code = code;
        this.payloadClass = payloadClass;
        this.family = family;
        this.defaultConcurrency = defaultConcurrency;
    }

    public String code() {
        return code;
    }

    public Class<?> payloadClass() {
        return payloadClass;
    }

    public QueueFamily family() {
        return family;
    }

    public int defaultConcurrency() {
        return defaultConcurrency;
    }

    public static JobType fromCode(String code) {
        if (code != null) {
            String trimmed = code.trim();
            for (JobType type : values()) {
                if (type.code.equals(trimmed)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown job type: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
