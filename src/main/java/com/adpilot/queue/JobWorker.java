package com.adpilot.queue;

import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.UUID;

/**
 * Interface representing a processor that can execute jobs of a specific type.
 * Note: The class must be registered as a Spring Bean to be detected by the
 * JobPoller.
 *
 * @param <T> the type of the payload expected by this processor
 */
public interface JobWorker<T> {

    /**
     * Returns the job kind this worker processes. By default, this is extracted from the
     * {@link com.adpilot.queue.annotation.Job} annotation.
     */
    default JobType getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.adpilot.queue.annotation.Job annotation = AnnotationUtils
                .findAnnotation(targetClass, com.adpilot.queue.annotation.Job.class);
        if (annotation == null) {
            throw new IllegalStateException("JobWorker " + targetClass.getName() +
                    " must either be annotated with @Job or override getJobType()");
        }
        return annotation.value();
    }

    /**
     * Processes a single job.
     *
     * @param jobId   the unique job ID
     * @param payload the deserialized payload
     * @return the outcome; {@code null} counts as success
     * @throws Exception if processing fails, classified into a retry or a permanent failure
     */
    JobResult process(UUID jobId, T payload) throws Exception;

    /**
     * Optional callback invoked when {@link #process(UUID, Object)} throws.
     * Throwing from this method does not replace the original processing failure.
     */
    default void onError(UUID jobId, T payload, Exception exception) {
        // no-op
    }

    /**
     * Optional callback invoked after successful execution.
     * Throwing from this method does not change the successful job outcome.
     */
    default void onSuccess(UUID jobId, T payload) {
        // no-op
    }

    /**
     * The payload class is fixed by the job kind.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        return (Class<T>) getJobType().payloadClass();
    }
}
