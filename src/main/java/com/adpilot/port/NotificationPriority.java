package com.adpilot.port;

public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
