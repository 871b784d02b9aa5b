package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.JobRepository;
import com.adpilot.queue.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Deletes finished jobs past their retention. Invoked by the {@code system:cleanup} job.
 */
@Component
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobRepository jobRepository;
    private final AdPilotProperties properties;

    public JobCleaner(JobRepository jobRepository, AdPilotProperties properties) {
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    public CleanupReport cleanup() {
        log.info("Running AdPilot job cleanup...");
        OffsetDateTime now = OffsetDateTime.now();
        int deletedCompleted = 0;
        int deletedFailed = 0;

        Duration completedRetention = properties.getQueue().getDeleteCompletedJobsAfter();
        if (completedRetention != null) {
            deletedCompleted = jobRepository.deleteByStatusAndFinishedAtBefore(JobStatus.COMPLETED,
                    now.minus(completedRetention));
            if (deletedCompleted > 0) {
                log.info("Cleaned up {} completed jobs older than {}", deletedCompleted, completedRetention);
            }
        }

        Duration failedRetention = properties.getQueue().getDeleteFailedJobsAfter();
        if (failedRetention != null) {
            deletedFailed = jobRepository.deleteByStatusAndFailedAtBefore(JobStatus.FAILED,
                    now.minus(failedRetention));
            if (deletedFailed > 0) {
                log.info("Permanently deleted {} failed jobs older than {}", deletedFailed, failedRetention);
            }
        }
        return new CleanupReport(deletedCompleted, deletedFailed);
    }

    public record CleanupReport(int deletedCompleted, int deletedFailed) {
    }
}
