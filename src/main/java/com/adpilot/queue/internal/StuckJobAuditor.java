package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.Job;
import com.adpilot.queue.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Reports jobs that have been ACTIVE longer than {@code adpilot.queue.stuck-job-timeout}. Stuck jobs are only
 * surfaced, never re-queued: the handler may still be running.
 */
@Component
@ConditionalOnProperty(prefix = "adpilot.queue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StuckJobAuditor {

    private static final Logger log = LoggerFactory.getLogger(StuckJobAuditor.class);

    private final JobRepository jobRepository;
    private final AdPilotProperties properties;

    public StuckJobAuditor(JobRepository jobRepository, AdPilotProperties properties) {
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${adpilot.queue.stuck-job-audit-interval-ms:60000}")
    public void audit() {
        try {
            List<Job> stuckJobs = findStuckJobs();
            for (Job job : stuckJobs) {
                log.warn("Job {} of type {} has been active since {} on {}", job.getId(), job.getType(),
                        job.getLockedAt(), job.getLockedBy());
            }
        } catch (Exception e) {
            log.error("Stuck job audit failed: {}", e.getMessage());
        }
    }

    public List<Job> findStuckJobs() {
        Duration timeout = properties.getQueue().getStuckJobTimeout();
        return jobRepository.findStuckJobs(OffsetDateTime.now().minus(timeout));
    }
}
