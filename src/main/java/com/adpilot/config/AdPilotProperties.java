package com.adpilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "adpilot")
public class AdPilotProperties {

    private final Database database = new Database();
    private final Queue queue = new Queue();
    private final Health health = new Health();
    private final Scheduler scheduler = new Scheduler();
    private final Decision decision = new Decision();
    private final AbTesting abTesting = new AbTesting();

    public Database getDatabase() {
        return database;
    }

    public Queue getQueue() {
        return queue;
    }

    public Health getHealth() {
        return health;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Decision getDecision() {
        return decision;
    }

    public AbTesting getAbTesting() {
        return abTesting;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Queue {
        private boolean enabled = true;
        private long pollIntervalMs = 1000;
        /**
         * Worker pool size overrides keyed by job type code, e.g. {@code marketing:campaign:monitor: 8}.
         */
        private Map<String, Integer> concurrency = new LinkedHashMap<>();
        private Duration stuckJobTimeout = Duration.ofMinutes(30);
        private Duration deleteCompletedJobsAfter = Duration.ofHours(24);
        private Duration deleteFailedJobsAfter = Duration.ofDays(7);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Map<String, Integer> getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(Map<String, Integer> concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getStuckJobTimeout() {
            return stuckJobTimeout;
        }

        public void setStuckJobTimeout(Duration stuckJobTimeout) {
            this.stuckJobTimeout = stuckJobTimeout;
        }

        public Duration getDeleteCompletedJobsAfter() {
            return deleteCompletedJobsAfter;
        }

        public void setDeleteCompletedJobsAfter(Duration deleteCompletedJobsAfter) {
            this.deleteCompletedJobsAfter = deleteCompletedJobsAfter;
        }

        public Duration getDeleteFailedJobsAfter() {
            return deleteFailedJobsAfter;
        }

        public void setDeleteFailedJobsAfter(Duration deleteFailedJobsAfter) {
            this.deleteFailedJobsAfter = deleteFailedJobsAfter;
        }
    }

    public static class Health {
        private long maxFailedJobs = 10;
        private long maxDelayedJobs = 50;
        private long maxWaitingJobs = 50;

        public long getMaxFailedJobs() {
            return maxFailedJobs;
        }

        public void setMaxFailedJobs(long maxFailedJobs) {
            this.maxFailedJobs = maxFailedJobs;
        }

        public long getMaxDelayedJobs() {
            return maxDelayedJobs;
        }

        public void setMaxDelayedJobs(long maxDelayedJobs) {
            this.maxDelayedJobs = maxDelayedJobs;
        }

        public long getMaxWaitingJobs() {
            return maxWaitingJobs;
        }

        public void setMaxWaitingJobs(long maxWaitingJobs) {
            this.maxWaitingJobs = maxWaitingJobs;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean registerDefaults = true;
        private String timezone = "UTC";
        private int poolSize = 2;
        private List<Definition> definitions = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRegisterDefaults() {
            return registerDefaults;
        }

        public void setRegisterDefaults(boolean registerDefaults) {
            this.registerDefaults = registerDefaults;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public List<Definition> getDefinitions() {
            return definitions;
        }

        public void setDefinitions(List<Definition> definitions) {
            this.definitions = definitions;
        }
    }

    /**
     * A recurring job declared in configuration.
     */
    public static class Definition {
        private String name;
        private String cronExpression;
        private String jobType;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public void setCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
        }

        public String getJobType() {
            return jobType;
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Decision {
        private int analysisWindowDays = 14;
        private double scaleScore = 70;
        private double pauseScore = 30;
        private double defaultTargetCpa = 50;
        private double defaultScaleFactor = 1.2;

        public int getAnalysisWindowDays() {
            return analysisWindowDays;
        }

        public void setAnalysisWindowDays(int analysisWindowDays) {
            this.analysisWindowDays = analysisWindowDays;
        }

        public double getScaleScore() {
            return scaleScore;
        }

        public void setScaleScore(double scaleScore) {
            this.scaleScore = scaleScore;
        }

        public double getPauseScore() {
            return pauseScore;
        }

        public void setPauseScore(double pauseScore) {
            this.pauseScore = pauseScore;
        }

        public double getDefaultTargetCpa() {
            return defaultTargetCpa;
        }

        public void setDefaultTargetCpa(double defaultTargetCpa) {
            this.defaultTargetCpa = defaultTargetCpa;
        }

        public double getDefaultScaleFactor() {
            return defaultScaleFactor;
        }

        public void setDefaultScaleFactor(double defaultScaleFactor) {
            this.defaultScaleFactor = defaultScaleFactor;
        }
    }

    public static class AbTesting {
        private long minimumSampleSize = 1000;
        private double significanceThreshold = 0.10;

        public long getMinimumSampleSize() {
            return minimumSampleSize;
        }

        public void setMinimumSampleSize(long minimumSampleSize) {
            this.minimumSampleSize = minimumSampleSize;
        }

        public double getSignificanceThreshold() {
            return significanceThreshold;
        }

        public void setSignificanceThreshold(double significanceThreshold) {
            this.significanceThreshold = significanceThreshold;
        }
    }
}
