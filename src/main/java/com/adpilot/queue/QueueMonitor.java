package com.adpilot.queue;

import com.adpilot.config.AdPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over the job table: counts and a health verdict.
 */
@Service
public class QueueMonitor {

    private static final Logger log = LoggerFactory.getLogger(QueueMonitor.class);

    private final JobRepository jobRepository;
    private final JdbcTemplate jdbcTemplate;
    private final AdPilotProperties properties;

    public QueueMonitor(JobRepository jobRepository, JdbcTemplate jdbcTemplate, AdPilotProperties properties) {
        this.jobRepository = jobRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    public QueueStats getStats() {
        Map<JobType, Map<JobStatus, Long>> byType = new EnumMap<>(JobType.class);
        Map<JobStatus, Long> totals = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            totals.put(status, 0L);
        }
        for (JobRepository.TypeStatusCount row : jobRepository.countByTypeAndStatus()) {
            if (row.getStatus() == null || row.getCount() == null) {
                continue;
            }
            JobType type;
            try {
                type = JobType.fromCode(row.getType());
            } catch (RuntimeException unknownType) {
                log.warn("Ignoring {} jobs of unknown type '{}'", row.getCount(), row.getType());
                continue;
            }
            byType.computeIfAbsent(type, key -> new EnumMap<>(JobStatus.class))
                    .merge(row.getStatus(), row.getCount(), Long::sum);
            totals.merge(row.getStatus(), row.getCount(), Long::sum);
        }
        return new QueueStats(byType, totals);
    }

    /**
     * UNHEALTHY when the job store cannot be reached, DEGRADED when a backlog or failure threshold is
     * exceeded or a job is stuck, HEALTHY otherwise.
     */
    public QueueHealth healthCheck() {
        QueueStats stats;
        long stuckJobs;
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            stats = getStats();
            stuckJobs = jobRepository.countStuckJobs(
                    OffsetDateTime.now().minus(properties.getQueue().getStuckJobTimeout()));
        } catch (RuntimeException e) {
            log.error("Queue health check failed", e);
            return new QueueHealth(QueueHealth.Status.UNHEALTHY,
                    List.of("Job store unreachable: " + e.getMessage()),
                    new QueueStats(Map.of(), Map.of()), 0);
        }

        AdPilotProperties.Health limits = properties.getHealth();
        List<String> problems = new ArrayList<>();
        long failed = stats.total(JobStatus.FAILED);
        long delayed = stats.total(JobStatus.DELAYED);
        long waiting = stats.total(JobStatus.WAITING);
        long active = stats.total(JobStatus.ACTIVE);

        if (failed > limits.getMaxFailedJobs()) {
            problems.add("Too many failed jobs: " + failed);
        }
        if (delayed > limits.getMaxDelayedJobs()) {
            problems.add("Too many delayed jobs: " + delayed);
        }
        if (active == 0 && waiting > limits.getMaxWaitingJobs()) {
            problems.add("Jobs are waiting but no jobs are active: " + waiting);
        }
        if (stuckJobs > 0) {
            problems.add("Stuck jobs: " + stuckJobs);
        }

        QueueHealth.Status status = problems.isEmpty() ? QueueHealth.Status.HEALTHY : QueueHealth.Status.DEGRADED;
        if (status != QueueHealth.Status.HEALTHY) {
            log.warn("Queue health is {}: {}", status, problems);
        }
        return new QueueHealth(status, problems, stats, stuckJobs);
    }
}
