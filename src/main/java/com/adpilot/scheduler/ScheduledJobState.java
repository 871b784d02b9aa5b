package com.adpilot.scheduler;

import java.time.ZonedDateTime;

public record ScheduledJobState(ScheduledJobDefinition definition, boolean running, ZonedDateTime nextExecution) {
}
