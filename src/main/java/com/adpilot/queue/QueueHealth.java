package com.adpilot.queue;

import java.util.List;

public record QueueHealth(Status status, List<String> problems, QueueStats stats, long stuckJobs) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    public QueueHealth {
        problems = List.copyOf(problems);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
