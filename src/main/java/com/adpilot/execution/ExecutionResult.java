package com.adpilot.execution;

/**
 * Outcome of applying one action.
 *
 * @param campaignId the affected campaign; {@code null} for business-level actions
 * @param action     the applied action, e.g. {@code SCALE} or {@code CLOSE}
 */
public record ExecutionResult(String campaignId, String action, Status status, String detail) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static ExecutionResult succeeded(String campaignId, String action, String detail) {
        return new ExecutionResult(campaignId, action, Status.SUCCEEDED, detail);
    }

    public static ExecutionResult failed(String campaignId, String action, String detail) {
        return new ExecutionResult(campaignId, action, Status.FAILED, detail);
    }

    public static ExecutionResult skipped(String campaignId, String action, String detail) {
        return new ExecutionResult(campaignId, action, Status.SKIPPED, detail);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
