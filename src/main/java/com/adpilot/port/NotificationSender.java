package com.adpilot.port;

/**
 * Delivers notifications over email, chat or webhooks. Delivery is best effort.
 */
public interface NotificationSender {

    void send(Notification notification);
}
