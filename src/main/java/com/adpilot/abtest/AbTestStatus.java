package com.adpilot.abtest;

import java.util.EnumSet;
import java.util.Set;

public enum AbTestStatus {
    RUNNING,
    COMPLETED,
    STOPPED,
    INCONCLUSIVE;

    public Set<AbTestStatus> allowedTransitions() {
        return switch (this) {
            case RUNNING -> EnumSet.of(COMPLETED, STOPPED, INCONCLUSIVE);
            case COMPLETED, STOPPED, INCONCLUSIVE -> EnumSet.noneOf(AbTestStatus.class);
        };
    }

    public boolean canTransitionTo(AbTestStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
