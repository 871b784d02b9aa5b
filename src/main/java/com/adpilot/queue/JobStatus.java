package com.adpilot.queue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle. The allowed transitions are:
 * <pre>
 *   WAITING -> ACTIVE
 *   DELAYED -> WAITING
 *   ACTIVE  -> COMPLETED | FAILED | DELAYED
 * </pre>
 * COMPLETED and FAILED are terminal.
 */
public enum JobStatus {

    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED,
    DELAYED;

    public Set<JobStatus> allowedTransitions() {
        return switch (this) {
            case WAITING -> EnumSet.of(ACTIVE);
            case DELAYED -> EnumSet.of(WAITING);
            case ACTIVE -> EnumSet.of(COMPLETED, FAILED, DELAYED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Jobs that have not been claimed by a worker yet and may still be cancelled.
     */
    public boolean isPending() {
        return this == WAITING || this == DELAYED;
    }
}
