package com.adpilot.queue;

import com.adpilot.error.ValidationException;
import com.adpilot.queue.internal.JobTypeMetadataRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.UUID;

@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final JobTypeMetadataRegistry jobTypeMetadataRegistry;

    public JobClient(JobRepository jobRepository, @Qualifier("adpilotObjectMapper") ObjectMapper objectMapper,
            JobTypeMetadataRegistry jobTypeMetadataRegistry) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.jobTypeMetadataRegistry = jobTypeMetadataRegistry;
    }

    /**
     * Enqueue a job with the defaults of its job type.
     */
    public UUID enqueue(JobType type, Object payload) {
        return enqueue(type, payload, JobOptions.defaults());
    }

    /**
     * Enqueue a job to run at the provided date-time.
     */
    public UUID enqueueAt(JobType type, Object payload, OffsetDateTime runAt) {
        if (runAt == null) {
            throw new ValidationException("runAt must not be null");
        }
        Duration delay = Duration.between(OffsetDateTime.now(), runAt);
        return enqueue(type, payload, JobOptions.defaults().withDelay(delay.isNegative() ? Duration.ZERO : delay));
    }

    /**
     * Full enqueue method. Validation happens before anything is persisted.
     *
     * @throws ValidationException when the payload does not match the job type or an option is out of range
     */
    public UUID enqueue(JobType type, Object payload, JobOptions options) {
        if (type == null) {
            throw new ValidationException("Job type must not be null");
        }
        validatePayload(type, payload);
        JobOptions resolvedOptions = options != null ? options : JobOptions.defaults();
        JobTypeMetadataRegistry.JobTypeMetadata defaults = jobTypeMetadataRegistry.metadataFor(type);

        int maxAttempts = resolvedOptions.maxAttempts() != null ? resolvedOptions.maxAttempts() : defaults.maxAttempts();
        if (maxAttempts < 1) {
            throw new ValidationException("maxAttempts must be >= 1");
        }
        Duration delay = resolvedOptions.delay() != null ? resolvedOptions.delay() : Duration.ZERO;
        if (delay.isNegative()) {
            throw new ValidationException("delay must be >= 0");
        }
        JobPriority priority = resolvedOptions.priority() != null ? resolvedOptions.priority() : defaults.priority();
        BackoffPolicy backoff = resolvedOptions.backoff() != null ? resolvedOptions.backoff() : defaults.backoff();

        JsonNode jsonNode = objectMapper.valueToTree(payload);
        OffsetDateTime now = OffsetDateTime.now();
        UUID jobId = UUID.randomUUID();
        Job job = new Job(jobId, type, jsonNode, maxAttempts, priority, backoff);
        job.setUpdatedAt(now);
        if (delay.isZero()) {
            job.setStatus(JobStatus.WAITING);
            job.setRunAt(now);
        } else {
            job.setStatus(JobStatus.DELAYED);
            job.setRunAt(now.plus(delay));
        }
        jobRepository.save(job);
        log.info("Enqueued job {} of type {} (priority={}, status={}, maxAttempts={})", jobId, type, priority,
                job.getStatus(), maxAttempts);
        return jobId;
    }

    /**
     * Removes a job that has not started yet.
     *
     * @return {@code true} if the job was WAITING or DELAYED and is now gone
     */
    public boolean cancel(UUID jobId) {
        if (jobId == null) {
            throw new ValidationException("jobId must not be null");
        }
        boolean cancelled = jobRepository.deleteByIdAndStatusIn(jobId,
                EnumSet.of(JobStatus.WAITING, JobStatus.DELAYED)) > 0;
        if (cancelled) {
            log.info("Cancelled job {}", jobId);
        } else {
            log.debug("Job {} was not cancelled because it is unknown or already running", jobId);
        }
        return cancelled;
    }

    private void validatePayload(JobType type, Object payload) {
        if (payload == null) {
            throw new ValidationException("Payload must not be null for job type " + type);
        }
        if (!type.payloadClass().isInstance(payload)) {
            throw new ValidationException("Job type " + type + " expects payload "
                    + type.payloadClass().getSimpleName() + " but got " + payload.getClass().getName());
        }
    }
}
