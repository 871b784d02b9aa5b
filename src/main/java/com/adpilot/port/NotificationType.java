package com.adpilot.port;

public enum NotificationType {
    MARKETING_DECISION,
    AB_TEST_RESULT,
    BUSINESS_ALERT,
    PAYMENT_ALERT,
    SYSTEM_ALERT
}
