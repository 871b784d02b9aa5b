package com.adpilot.queue.annotation;

import com.adpilot.queue.BackoffPolicy;
import com.adpilot.queue.JobPriority;
import com.adpilot.queue.JobType;

import java.lang.annotation.*;

/**
 * Marks a {@link com.adpilot.queue.JobWorker} bean and overrides the queue defaults of the job type it
 * handles. Negative values keep the job type default.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The job kind this worker handles.
     */
    JobType value();

    /**
     * Worker pool size for this job kind.
     */
    int concurrency() default -1;

    /**
     * Total number of attempts before the job is marked FAILED permanently.
     */
    int maxAttempts() default -1;

    /**
     * Delay before the first retry, in milliseconds.
     */
    long backoffDelayMs() default -1;

    BackoffPolicy.Type[] backoffType() default {};

    JobPriority[] priority() default {};
}
