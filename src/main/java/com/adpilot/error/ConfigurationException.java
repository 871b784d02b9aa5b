package com.adpilot.error;

public class ConfigurationException extends AdPilotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CONFIGURATION;
    }
}
