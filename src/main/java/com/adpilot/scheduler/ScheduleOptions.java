package com.adpilot.scheduler;

import com.adpilot.queue.JobPriority;

/**
 * @param enabled  whether the trigger starts immediately
 * @param timezone IANA zone the cron expression is evaluated in; {@code null} uses the scheduler default
 * @param priority priority of the enqueued jobs; {@code null} uses the job type default
 */
public record ScheduleOptions(boolean enabled, String timezone, JobPriority priority) {

    public static ScheduleOptions defaults() {
        return new ScheduleOptions(true, null, null);
    }

    public ScheduleOptions withEnabled(boolean enabled) {
        return new ScheduleOptions(enabled, timezone, priority);
    }

    public ScheduleOptions withTimezone(String timezone) {
        return new ScheduleOptions(enabled, timezone, priority);
    }

    public ScheduleOptions withPriority(JobPriority priority) {
        return new ScheduleOptions(enabled, timezone, priority);
    }
}
