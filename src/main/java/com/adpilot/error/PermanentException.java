package com.adpilot.error;

public class PermanentException extends AdPilotException {

    public PermanentException(String message) {
        super(message);
    }

    public PermanentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.PERMANENT;
    }
}
