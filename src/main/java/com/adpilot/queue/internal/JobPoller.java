package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.FailureKind;
import com.adpilot.error.ValidationException;
import com.adpilot.queue.BackoffPolicy;
import com.adpilot.queue.Job;
import com.adpilot.queue.JobHandler;
import com.adpilot.queue.JobRepository;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobStatus;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.ClassUtils;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims due jobs and runs them on a fixed-size worker pool per job type.
 * <p>
 * Each poll first promotes DELAYED jobs whose {@code run_at} has passed, then, for every registered job
 * type, claims at most as many WAITING jobs as its pool has free slots
 * ({@code ORDER BY priority DESC, created_at ASC ... FOR UPDATE SKIP LOCKED}).
 */
@Component
@ConditionalOnProperty(prefix = "adpilot.queue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final JobRepository jobRepository;
    private final List<JobWorker<?>> workers;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final JobTypeMetadataRegistry metadataRegistry;
    private final ThreadPoolExecutor pollingExecutor;

    private final String nodeId = "node-" + UUID.randomUUID();
    private final Map<JobType, RegisteredJob> jobMap = new ConcurrentHashMap<>();

    public JobPoller(
            JobRepository jobRepository,
            List<JobWorker<?>> workers,
            @Qualifier("adpilotObjectMapper") ObjectMapper objectMapper,
            TransactionTemplate transactionTemplate,
            JobTypeMetadataRegistry metadataRegistry,
            AdPilotProperties properties) {
        this.jobRepository = jobRepository;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.metadataRegistry = metadataRegistry;

        int pollThreads = Math.min(4, Math.max(1, JobType.values().length / 4));
        this.pollingExecutor = new ThreadPoolExecutor(
                pollThreads,
                pollThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(32, JobType.values().length * 2)),
                new ThreadPoolExecutor.CallerRunsPolicy());
        log.debug("Job poller {} created with poll interval {}ms", nodeId, properties.getQueue().getPollIntervalMs());
    }

    @PostConstruct
    public void init() {
        for (JobWorker<?> worker : workers) {
            registerWorker(worker);
        }
        log.info("Job poller initialized on {} with {} registered job types: {}", nodeId, jobMap.size(),
                jobMap.keySet());
    }

    /**
     * Registers a handler for a job type using its configured pool size.
     */
    public <T> void registerHandler(JobType type, JobHandler<T> handler) {
        registerHandler(type, handler, metadataRegistry.concurrencyFor(type));
    }

    /**
     * Registers a handler with an explicit pool size.
     *
     * @throws IllegalStateException if the type already has a handler
     */
    @SuppressWarnings("unchecked")
    public <T> void registerHandler(JobType type, JobHandler<T> handler, int concurrency) {
        if (type == null || handler == null) {
            throw new ValidationException("Job type and handler must not be null");
        }
        if (concurrency < 1) {
            throw new ValidationException("concurrency must be >= 1 for job type " + type);
        }
        JobHandler<Object> untyped = (JobHandler<Object>) handler;
        register(new RegisteredJob(type, payloadReaderFor(type.payloadClass()), untyped::handle,
                (jobId, payload, exception) -> {
                }, (jobId, payload) -> {
                }, newWorkerPool(type, concurrency), concurrency, new AtomicBoolean(false)),
                "handler " + ClassUtils.getUserClass(handler).getName());
    }

    public Set<JobType> registeredTypes() {
        return Set.copyOf(jobMap.keySet());
    }

    public String getNodeId() {
        return nodeId;
    }

    @Scheduled(fixedDelayString = "${adpilot.queue.poll-interval-ms:1000}")
    public void poll() {
        promoteDelayedJobs();
        if (jobMap.isEmpty()) {
            return;
        }
        for (RegisteredJob registration : jobMap.values()) {
            AtomicBoolean inProgress = registration.pollInProgress();
            if (!inProgress.compareAndSet(false, true)) {
                continue;
            }

            try {
                pollingExecutor.execute(() -> {
                    try {
                        pollForType(registration);
                    } finally {
                        inProgress.set(false);
                    }
                });
            } catch (RejectedExecutionException saturatedPollingQueue) {
                inProgress.set(false);
                log.debug("Skipping poll dispatch for type {} because polling queue is saturated", registration.type());
            }
        }
    }

    void promoteDelayedJobs() {
        try {
            Integer promoted = transactionTemplate.execute(
                    status -> jobRepository.promoteDueDelayedJobs(OffsetDateTime.now()));
            if (toAffectedRows(promoted) > 0) {
                log.debug("Promoted {} delayed jobs to WAITING", promoted);
            }
        } catch (RuntimeException e) {
            log.error("Failed to promote delayed jobs", e);
        }
    }

    private void pollForType(RegisteredJob registration) {
        int availableSlots = availableProcessingSlots(registration);
        if (availableSlots <= 0) {
            return;
        }

        List<Job> jobs;
        try {
            jobs = claim(registration.type(), availableSlots);
        } catch (RuntimeException e) {
            log.error("Failed to claim jobs of type {}", registration.type(), e);
            return;
        }
        if (jobs.isEmpty()) {
            return;
        }

        for (Job job : jobs) {
            registration.executor().execute(() -> processJob(job, registration));
        }
    }

    List<Job> claim(JobType type, int batchSize) {
        List<Job> jobs = transactionTemplate.execute(status -> {
            List<Job> nextJobs = jobRepository.findNextJobsForUpdate(type.code(), PageRequest.of(0, batchSize));
            if (nextJobs.isEmpty()) {
                return List.<Job>of();
            }
            OffsetDateTime lockTime = OffsetDateTime.now();
            for (Job j : nextJobs) {
                j.transitionTo(JobStatus.ACTIVE);
                j.setLockedAt(lockTime);
                j.setLockedBy(nodeId);
            }
            jobRepository.saveAll(nextJobs);
            return nextJobs;
        });
        if (jobs == null) {
            return List.of();
        }
        for (Job job : jobs) {
            log.info("Claimed job {} of type {} (attempt {}/{})", job.getId(), type, job.getAttemptsMade() + 1,
                    job.getMaxAttempts());
        }
        return jobs;
    }

    private int availableProcessingSlots(RegisteredJob registration) {
        ThreadPoolExecutor executor = registration.executor();
        int inFlight = executor.getActiveCount() + executor.getQueue().size();
        return registration.concurrency() - inFlight;
    }

    /**
     * Runs one claimed job to completion and records its outcome.
     */
    void processJob(Job job, RegisteredJob registration) {
        Object payload = null;
        JobResult result;
        try {
            payload = registration.payloadReader().read(job.getPayload());
            result = registration.invoker().invoke(job.getId(), payload);
            if (result == null) {
                result = JobResult.success();
            }
        } catch (Exception e) {
            invokeOnErrorSafely(registration, job.getId(), payload, e);
            result = JobResult.fromException(e);
            log.error("Failed to process job {} of type {} ({})", job.getId(), job.getType(),
                    result.getFailureKind(), e);
        }

        switch (result.getOutcome()) {
            case SUCCEEDED -> {
                markCompleted(job, result);
                invokeOnSuccessSafely(registration, job.getId(), payload);
                log.info("Completed job {} of type {}", job.getId(), job.getType());
            }
            case RETRY, FAILED -> handleFailure(job, result);
        }
    }

    RegisteredJob registrationFor(JobType type) {
        return jobMap.get(type);
    }

    private void invokeOnErrorSafely(RegisteredJob registration, UUID jobId, Object payload, Exception error) {
        try {
            registration.errorHandler().onError(jobId, payload, error);
        } catch (Exception onErrorFailure) {
            log.error("onError callback failed for job {} of type {}", jobId, registration.type(), onErrorFailure);
        }
    }

    private void invokeOnSuccessSafely(RegisteredJob registration, UUID jobId, Object payload) {
        try {
            registration.successHandler().onSuccess(jobId, payload);
        } catch (Exception onSuccessFailure) {
            log.error("onSuccess callback failed for job {} of type {}", jobId, registration.type(),
                    onSuccessFailure);
        }
    }

    @SuppressWarnings("unchecked")
    private void registerWorker(JobWorker<?> worker) {
        JobType type = worker.getJobType();
        JobWorker<Object> untyped = (JobWorker<Object>) worker;
        int concurrency = metadataRegistry.concurrencyFor(type);
        register(new RegisteredJob(type, payloadReaderFor(worker.getPayloadClass()), untyped::process,
                untyped::onError, untyped::onSuccess, newWorkerPool(type, concurrency), concurrency,
                new AtomicBoolean(false)),
                "JobWorker bean " + ClassUtils.getUserClass(worker).getName());
    }

    private void register(RegisteredJob registration, String source) {
        RegisteredJob existing = jobMap.putIfAbsent(registration.type(), registration);
        if (existing != null) {
            registration.executor().shutdown();
            throw new IllegalStateException(
                    "Duplicate handler for job type '" + registration.type() + "' detected while registering "
                            + source + ". Each job type must be unique.");
        }
        log.debug("Registered {} for job type {} with concurrency {}", source, registration.type(),
                registration.concurrency());
    }

    private ThreadPoolExecutor newWorkerPool(JobType type, int concurrency) {
        AtomicInteger threadIndex = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(8, concurrency * 4)),
                runnable -> {
                    Thread thread = new Thread(runnable, "adpilot-" + type.code() + "-" + threadIndex.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }

    private PayloadReader payloadReaderFor(Class<?> payloadClass) {
        ObjectReader reader = objectMapper.readerFor(payloadClass);
        return rawPayload -> {
            if (rawPayload == null || rawPayload.isNull()) {
                throw new ValidationException("Job has no payload, expected " + payloadClass.getSimpleName());
            }
            try {
                return reader.readValue(rawPayload);
            } catch (Exception e) {
                throw new ValidationException("Payload cannot be read as " + payloadClass.getSimpleName(), e);
            }
        };
    }

    private void markCompleted(Job jobSnapshot, JobResult result) {
        JsonNode resultNode = result.getData() != null ? objectMapper.valueToTree(result.getData()) : null;
        transactionTemplate.executeWithoutResult(status -> jobRepository.findById(jobSnapshot.getId()).ifPresent(job -> {
            if (!isMutableActiveJob(job)) {
                log.debug("Skipping completion of job {} due lifecycle/lock mismatch", jobSnapshot.getId());
                return;
            }
            job.transitionTo(JobStatus.COMPLETED);
            job.setAttemptsMade(Math.min(job.getMaxAttempts(), job.getAttemptsMade() + 1));
            job.setResult(resultNode);
            job.setErrorMessage(null);
            job.setFailureKind(null);
            job.setLockedAt(null);
            job.setLockedBy(null);
            jobRepository.save(job);
        }));
    }

    private void handleFailure(Job jobSnapshot, JobResult result) {
        OffsetDateTime now = OffsetDateTime.now();
        int currentAttempts = jobSnapshot.getAttemptsMade();
        int nextAttempts = currentAttempts + 1;
        String errorMessage = result.getMessage();
        FailureKind kind = result.getFailureKind() != null ? result.getFailureKind() : FailureKind.TRANSIENT;
        boolean retry = result.getOutcome() == JobResult.Outcome.RETRY && nextAttempts < jobSnapshot.getMaxAttempts();

        if (retry) {
            OffsetDateTime nextRunAt = nextRunAt(jobSnapshot.getBackoff(), nextAttempts, now);
            Integer updated = transactionTemplate.execute(status -> jobRepository.markForRetry(
                    jobSnapshot.getId(),
                    currentAttempts,
                    nextAttempts,
                    errorMessage,
                    kind,
                    now,
                    nextRunAt,
                    nodeId));
            log.warn("Job {} of type {} failed attempt {}/{}, retrying at {}: {}", jobSnapshot.getId(),
                    jobSnapshot.getType(), nextAttempts, jobSnapshot.getMaxAttempts(), nextRunAt, errorMessage);
            if (toAffectedRows(updated) > 0) {
                return;
            }
        } else {
            Integer updated = transactionTemplate.execute(status -> jobRepository.markFailedTerminal(
                    jobSnapshot.getId(),
                    currentAttempts,
                    nextAttempts,
                    errorMessage,
                    kind,
                    now,
                    nodeId));
            log.error("Job {} of type {} failed permanently after {} attempt(s) ({}): {}", jobSnapshot.getId(),
                    jobSnapshot.getType(), nextAttempts, kind, errorMessage);
            if (toAffectedRows(updated) > 0) {
                return;
            }
        }

        log.debug("Falling back to entity failure update for job {}", jobSnapshot.getId());
        fallbackFailureUpdate(jobSnapshot.getId(), retry, errorMessage, kind);
    }

    private void fallbackFailureUpdate(UUID jobId, boolean retry, String errorMessage, FailureKind kind) {
        transactionTemplate.executeWithoutResult(status -> jobRepository.findById(jobId).ifPresent(job -> {
            if (!isMutableActiveJob(job)) {
                log.debug("Skipping failure fallback for job {} due lifecycle/lock mismatch", jobId);
                return;
            }
            OffsetDateTime now = OffsetDateTime.now();
            job.setErrorMessage(errorMessage);
            job.setFailureKind(kind);
            job.setAttemptsMade(job.getAttemptsMade() + 1);
            job.setLockedAt(null);
            job.setLockedBy(null);

            if (retry) {
                job.transitionTo(JobStatus.DELAYED);
                job.setRunAt(nextRunAt(job.getBackoff(), job.getAttemptsMade(), now));
            } else {
                job.transitionTo(JobStatus.FAILED);
            }
            jobRepository.save(job);
        }));
    }

    private OffsetDateTime nextRunAt(BackoffPolicy backoff, int attemptsMade, OffsetDateTime now) {
        return now.plus(backoff.delayAfter(attemptsMade));
    }

    private int toAffectedRows(Integer updatedRows) {
        return updatedRows == null ? 0 : updatedRows;
    }

    private boolean isMutableActiveJob(Job job) {
        return job.getStatus() == JobStatus.ACTIVE
                && job.getLockedAt() != null
                && nodeId.equals(job.getLockedBy());
    }

    @FunctionalInterface
    interface JobInvoker {
        JobResult invoke(UUID jobId, Object payload) throws Exception;
    }

    @FunctionalInterface
    interface PayloadReader {
        Object read(JsonNode rawPayload);
    }

    @FunctionalInterface
    interface JobErrorHandler {
        void onError(UUID jobId, Object payload, Exception exception) throws Exception;
    }

    @FunctionalInterface
    interface JobSuccessHandler {
        void onSuccess(UUID jobId, Object payload) throws Exception;
    }

    record RegisteredJob(
            JobType type,
            PayloadReader payloadReader,
            JobInvoker invoker,
            JobErrorHandler errorHandler,
            JobSuccessHandler successHandler,
            ThreadPoolExecutor executor,
            int concurrency,
            AtomicBoolean pollInProgress) {
    }

    @PreDestroy
    void shutdownExecutor() {
        pollingExecutor.shutdown();
        for (RegisteredJob registration : jobMap.values()) {
            registration.executor().shutdown();
        }
    }
}
