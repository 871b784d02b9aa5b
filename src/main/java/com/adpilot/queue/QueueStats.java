package com.adpilot.queue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts by status, per job type and in total.
 */
public record QueueStats(Map<JobType, Map<JobStatus, Long>> byType, Map<JobStatus, Long> totals) {

    public QueueStats {
        byType = Collections.unmodifiableMap(new EnumMap<>(byType.isEmpty() ? new EnumMap<>(JobType.class) : byType));
        totals = Collections.unmodifiableMap(new EnumMap<>(totals.isEmpty() ? new EnumMap<>(JobStatus.class) : totals));
    }

    public long total(JobStatus status) {
        return totals.getOrDefault(status, 0L);
    }

    public long count(JobType type, JobStatus status) {
        Map<JobStatus, Long> counts = byType.get(type);
        return counts == null ? 0L : counts.getOrDefault(status, 0L);
    }
}
