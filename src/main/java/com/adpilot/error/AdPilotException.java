package com.adpilot.error;

public abstract class AdPilotException extends RuntimeException {

    protected AdPilotException(String message) {
        super(message);
    }

    protected AdPilotException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getKind();
}
