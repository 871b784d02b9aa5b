package com.adpilot.port;

public enum BusinessStatus {
    PLANNING,
    DEVELOPING,
    DEPLOYING,
    ACTIVE,
    PAUSED,
    CLOSED
}
