package com.adpilot.worker;

import com.adpilot.execution.NotificationDispatcher;
import com.adpilot.port.Notification;
import com.adpilot.port.NotificationPriority;
import com.adpilot.port.NotificationType;
import com.adpilot.queue.JobPayloads.SystemTask;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.QueueHealth;
import com.adpilot.queue.QueueMonitor;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs the queue health check and raises a system alert when the queue is not healthy.
 */
@Component
@Job(JobType.SYSTEM_HEALTH)
public class SystemHealthWorker implements JobWorker<SystemTask> {

    private static final Logger log = LoggerFactory.getLogger(SystemHealthWorker.class);

    private final QueueMonitor queueMonitor;
    private final NotificationDispatcher notifications;

    public SystemHealthWorker(QueueMonitor queueMonitor, NotificationDispatcher notifications) {
        this.queueMonitor = queueMonitor;
        this.notifications = notifications;
    }

    @Override
    public JobResult process(UUID jobId, SystemTask payload) {
        QueueHealth health = queueMonitor.healthCheck();
        if (health.isHealthy()) {
            log.debug("Job queue healthy");
        } else {
            log.warn("Job queue {}: {}", health.status(), health.problems());
            notifications.dispatch(new Notification(
                    NotificationType.SYSTEM_ALERT,
                    health.status() == QueueHealth.Status.UNHEALTHY
                            ? NotificationPriority.CRITICAL
                            : NotificationPriority.HIGH,
                    null,
                    "Job queue " + health.status().name().toLowerCase(Locale.ROOT) + ": "
                            + String.join("; ", health.problems()),
                    Map.of("problems", health.problems(), "stuckJobs", health.stuckJobs()),
                    Set.of(),
                    null,
                    OffsetDateTime.now()));
        }
        return JobResult.success(Map.of("status", health.status().name(), "problems", health.problems()));
    }
}
