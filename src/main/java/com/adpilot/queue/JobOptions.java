package com.adpilot.queue;

import java.time.Duration;

/**
 * Per-enqueue overrides. Any component left {@code null} falls back to the job type defaults.
 */
public record JobOptions(JobPriority priority, Duration delay, Integer maxAttempts, BackoffPolicy backoff) {

    private static final JobOptions DEFAULTS = new JobOptions(null, null, null, null);

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public JobOptions withPriority(JobPriority priority) {
        return new JobOptions(priority, delay, maxAttempts, backoff);
    }

    public JobOptions withDelay(Duration delay) {
        return new JobOptions(priority, delay, maxAttempts, backoff);
    }

    public JobOptions withMaxAttempts(int maxAttempts) {
        return new JobOptions(priority, delay, maxAttempts, backoff);
    }

    public JobOptions withBackoff(BackoffPolicy backoff) {
        return new JobOptions(priority, delay, maxAttempts, backoff);
    }
}
