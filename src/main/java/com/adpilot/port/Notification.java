package com.adpilot.port;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;

/**
 * @param channels   where to deliver; empty leaves the choice to the sender
 * @param webhookUrl target of the {@link NotificationChannel#WEBHOOK} channel
 */
public record Notification(
        NotificationType type,
        NotificationPriority priority,
        String businessId,
        String summary,
        Map<String, Object> payload,
        Set<NotificationChannel> channels,
        String webhookUrl,
        OffsetDateTime timestamp) {

    public Notification {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        channels = channels != null ? Set.copyOf(channels) : Set.of();
    }
}
