package com.adpilot.error;

public class TransientException extends AdPilotException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.TRANSIENT;
    }
}
