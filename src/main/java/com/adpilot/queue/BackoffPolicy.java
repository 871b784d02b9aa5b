package com.adpilot.queue;

import java.time.Duration;

/**
 * Delay between retry attempts.
 *
 * @param type        fixed or exponential
 * @param baseDelayMs the delay before the first retry
 */
public record BackoffPolicy(Type type, long baseDelayMs) {

    public enum Type {
        FIXED,
        EXPONENTIAL
    }

    public BackoffPolicy {
        if (type == null) {
            throw new IllegalArgumentException("Backoff type must not be null");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("Backoff base delay must be >= 0");
        }
    }

    public static BackoffPolicy fixed(long baseDelayMs) {
        return new BackoffPolicy(Type.FIXED, baseDelayMs);
    }

    public static BackoffPolicy exponential(long baseDelayMs) {
        return new BackoffPolicy(Type.EXPONENTIAL, baseDelayMs);
    }

    /**
     * Delay to apply after the given number of failed attempts (1-based), so the first retry
     * always waits {@code baseDelayMs}.
     */
    public Duration delayAfter(int failedAttempts) {
        if (type == Type.FIXED) {
            return Duration.ofMillis(baseDelayMs);
        }
        int exponent = Math.max(0, failedAttempts - 1);
        // 2^30 * base already exceeds any sane retry horizon
        long multiplier = 1L << Math.min(exponent, 30);
        long delayMs = baseDelayMs > Long.MAX_VALUE / multiplier ? Long.MAX_VALUE : baseDelayMs * multiplier;
        return Duration.ofMillis(delayMs);
    }
}
