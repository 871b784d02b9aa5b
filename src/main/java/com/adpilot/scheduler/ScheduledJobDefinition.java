package com.adpilot.scheduler;

import com.adpilot.queue.JobPriority;
import com.adpilot.queue.JobType;

/**
 * A named recurring trigger. {@code cronExpression} is kept in Spring's six-field form.
 */
public record ScheduledJobDefinition(
        String name,
        String cronExpression,
        JobType jobType,
        Object payload,
        boolean enabled,
        String timezone,
        JobPriority priority) {
}
