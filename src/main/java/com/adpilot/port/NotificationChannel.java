package com.adpilot.port;

public enum NotificationChannel {
    EMAIL,
    SLACK,
    WEBHOOK
}
