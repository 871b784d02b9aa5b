package com.adpilot.execution;

import com.adpilot.port.Notification;
import com.adpilot.port.NotificationSender;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Hands notifications to the {@link NotificationSender} on a background thread. Delivery failures are
 * logged and never reach the caller.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ObjectProvider<NotificationSender> sender;
    private final ThreadPoolExecutor executor;

    public NotificationDispatcher(ObjectProvider<NotificationSender> sender) {
        this.sender = sender;
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000),
                runnable -> {
                    Thread thread = new Thread(runnable, "adpilot-notifications");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    public void dispatch(Notification notification) {
        NotificationSender target = sender.getIfAvailable();
        if (target == null) {
            log.debug("No NotificationSender configured; dropping {} notification for business {}",
                    notification.type(), notification.businessId());
            return;
        }
        try {
            executor.execute(() -> deliver(target, notification));
        } catch (RejectedExecutionException e) {
            log.warn("Notification for business {} rejected: {}", notification.businessId(), e.getMessage());
        }
    }

    private void deliver(NotificationSender target, Notification notification) {
        try {
            target.send(notification);
            log.info("Sent {} {} notification for business {} via {}", notification.priority(),
                    notification.type(), notification.businessId(), notification.channels());
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification for business {}", notification.type(),
                    notification.businessId(), e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
