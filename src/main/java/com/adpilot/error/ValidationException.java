package com.adpilot.error;

public class ValidationException extends AdPilotException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.VALIDATION;
    }
}
