package com.adpilot.queue;

import java.util.UUID;

/**
 * Programmatic handler registered with {@link com.adpilot.queue.internal.JobPoller#registerHandler}.
 *
 * @param <T> payload type of the job kind
 */
@FunctionalInterface
public interface JobHandler<T> {

    /**
     * Processes one job. Returning {@code null} counts as success; thrown exceptions are classified by
     * {@link com.adpilot.error.FailureKind#classify(Throwable)}.
     */
    JobResult handle(UUID jobId, T payload) throws Exception;
}
