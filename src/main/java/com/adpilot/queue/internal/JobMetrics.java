package com.adpilot.queue.internal;

import com.adpilot.queue.JobRepository;
import com.adpilot.queue.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class JobMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobStatus, Long> cachedSnapshot = emptySnapshot();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public JobMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering AdPilot job gauges...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("adpilot.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of AdPilot jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder("adpilot.jobs.total", this, JobMetrics::totalCount)
                .description("Total number of AdPilot jobs in the database")
                .register(meterRegistry);
    }

    private double countFor(JobStatus status) {
        return getSnapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        return getSnapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<JobStatus, Long> getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private Map<JobStatus, Long> loadSnapshot() {
        try {
            Map<JobStatus, Long> counts = emptySnapshot();
            for (JobRepository.TypeStatusCount row : jobRepository.countByTypeAndStatus()) {
                if (row.getStatus() != null && row.getCount() != null) {
                    counts.merge(row.getStatus(), row.getCount(), Long::sum);
                }
            }
            return counts;
        } catch (Exception e) {
            log.trace("Failed to query job counts for metrics: {}", e.getMessage());
            return emptySnapshot();
        }
    }

    private static Map<JobStatus, Long> emptySnapshot() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        return counts;
    }
}
