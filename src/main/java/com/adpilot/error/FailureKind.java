package com.adpilot.error;

/**
 * Classification of a failed unit of work. Drives the retry decision of the job queue.
 */
public enum FailureKind {

    /**
     * Malformed input. Rejected before any state change and never retried.
     */
    VALIDATION(false),

    /**
     * Adapter or network failure. Retried per the job backoff policy.
     */
    TRANSIENT(true),

    /**
     * Missing credentials, entity not found. Surfaced immediately.
     */
    PERMANENT(false),

    /**
     * Missing required secret or setting. Fails the affected job only.
     */
    CONFIGURATION(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Walks the cause chain looking for one of our exceptions. Anything unclassified is treated
     * as transient.
     */
    public static FailureKind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof AdPilotException adPilotException) {
                return adPilotException.getKind();
            }
            current = current.getCause();
        }
        return TRANSIENT;
    }
}
