package com.adpilot.queue;

import com.adpilot.error.FailureKind;

import java.util.Objects;

/**
 * Outcome of one handler invocation. Handlers may also throw; thrown exceptions are turned into a result
 * with {@link #fromException(Throwable)}.
 */
public final class JobResult {

    public enum Outcome {
        SUCCEEDED,
        RETRY,
        FAILED
    }

    private static final JobResult EMPTY_SUCCESS = new JobResult(Outcome.SUCCEEDED, null, null, null);

    private final Outcome outcome;
    private final Object data;
    private final String message;
    private final FailureKind failureKind;

    private JobResult(Outcome outcome, Object data, String message, FailureKind failureKind) {
        this.outcome = outcome;
        this.data = data;
        this.message = message;
        this.failureKind = failureKind;
    }

    public static JobResult success() {
        return EMPTY_SUCCESS;
    }

    public static JobResult success(Object data) {
        return new JobResult(Outcome.SUCCEEDED, data, null, null);
    }

    public static JobResult retry(String message) {
        return new JobResult(Outcome.RETRY, null, message, FailureKind.TRANSIENT);
    }

    public static JobResult failed(FailureKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isRetryable()) {
            return new JobResult(Outcome.RETRY, null, message, kind);
        }
        return new JobResult(Outcome.FAILED, null, message, kind);
    }

    public static JobResult fromException(Throwable exception) {
        FailureKind kind = FailureKind.classify(exception);
        String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
        return failed(kind, message);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Object getData() {
        return data;
    }

    public String getMessage() {
        return message;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    @Override
    public String toString() {
        return "JobResult{" + outcome + (failureKind != null ? ", " + failureKind : "")
                + (message != null ? ", '" + message + "'" : "") + "}";
    }
}
