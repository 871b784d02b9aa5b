package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.FailureKind;
import com.adpilot.error.PermanentException;
import com.adpilot.error.TransientException;
import com.adpilot.queue.BackoffPolicy;
import com.adpilot.queue.Job;
import com.adpilot.queue.JobHandler;
import com.adpilot.queue.JobPayloads;
import com.adpilot.queue.JobPriority;
import com.adpilot.queue.JobRepository;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobStatus;
import com.adpilot.queue.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobPollerTest {

    private JobRepository jobRepository;
    private JobPoller jobPoller;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        JobTypeMetadataRegistry metadataRegistry = mock(JobTypeMetadataRegistry.class);
        when(metadataRegistry.concurrencyFor(any(JobType.class))).thenReturn(1);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));

        jobPoller = new JobPoller(jobRepository, List.of(), objectMapper, transactionTemplate, metadataRegistry,
                new AdPilotProperties());
    }

    @AfterEach
    void tearDown() {
        jobPoller.shutdownExecutor();
    }

    @Test
    void shouldRejectDuplicateHandlerRegistration() {
        jobPoller.registerHandler(JobType.SYSTEM_HEALTH, (jobId, payload) -> JobResult.success(), 1);

        assertThatThrownBy(() -> jobPoller.registerHandler(JobType.SYSTEM_HEALTH,
                (jobId, payload) -> JobResult.success(), 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate handler");
    }

    @Test
    void shouldClaimWaitingJobsForThisNode() {
        Job first = waitingJob();
        Job second = waitingJob();
        when(jobRepository.findNextJobsForUpdate(eq("system:health"), any(Pageable.class)))
                .thenReturn(List.of(first, second));

        List<Job> claimed = jobPoller.claim(JobType.SYSTEM_HEALTH, 2);

        assertThat(claimed).containsExactly(first, second);
        assertThat(claimed).allSatisfy(job -> {
            assertThat(job.getStatus()).isEqualTo(JobStatus.ACTIVE);
            assertThat(job.getLockedBy()).isEqualTo(jobPoller.getNodeId());
            assertThat(job.getLockedAt()).isNotNull();
        });
        verify(jobRepository).saveAll(List.of(first, second));
    }

    @Test
    void shouldCompleteJobAndStoreResult() {
        Job job = activeJob(0, 3);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        register((jobId, payload) -> JobResult.success(Map.of("trigger", payload.trigger())));

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).save(job);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttemptsMade()).isEqualTo(1);
        assertThat(job.getResult().get("trigger").asText()).isEqualTo("test");
        assertThat(job.getLockedBy()).isNull();
    }

    @Test
    void shouldScheduleRetryWithBackoffForTransientFailure() {
        Job job = activeJob(0, 3);
        when(jobRepository.markForRetry(any(), anyInt(), anyInt(), any(), any(), any(), any(), any())).thenReturn(1);
        register((jobId, payload) -> {
            throw new TransientException("platform timeout");
        });

        OffsetDateTime before = OffsetDateTime.now();
        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        ArgumentCaptor<OffsetDateTime> nextRunAt = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(jobRepository).markForRetry(eq(job.getId()), eq(0), eq(1), eq("platform timeout"),
                eq(FailureKind.TRANSIENT), any(OffsetDateTime.class), nextRunAt.capture(),
                eq(jobPoller.getNodeId()));
        assertThat(Duration.between(before, nextRunAt.getValue()).toMillis()).isBetween(1_000L, 2_000L);
        verify(jobRepository, never()).markFailedTerminal(any(), anyInt(), anyInt(), any(), any(), any(), any());
    }

    @Test
    void shouldTreatRetryResultLikeTransientFailure() {
        Job job = activeJob(1, 3);
        when(jobRepository.markForRetry(any(), anyInt(), anyInt(), any(), any(), any(), any(), any())).thenReturn(1);
        register((jobId, payload) -> JobResult.retry("not ready"));

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).markForRetry(eq(job.getId()), eq(1), eq(2), eq("not ready"),
                eq(FailureKind.TRANSIENT), any(), any(), anyString());
    }

    @Test
    void shouldFailPermanentlyWithoutRetry() {
        Job job = activeJob(0, 3);
        when(jobRepository.markFailedTerminal(any(), anyInt(), anyInt(), any(), any(), any(), any())).thenReturn(1);
        register((jobId, payload) -> {
            throw new PermanentException("Campaign not found: c1");
        });

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).markFailedTerminal(eq(job.getId()), eq(0), eq(1), eq("Campaign not found: c1"),
                eq(FailureKind.PERMANENT), any(OffsetDateTime.class), eq(jobPoller.getNodeId()));
        verify(jobRepository, never()).markForRetry(any(), anyInt(), anyInt(), any(), any(), any(), any(), any());
    }

    @Test
    void shouldFailPermanentlyWhenAttemptsAreExhausted() {
        Job job = activeJob(2, 3);
        when(jobRepository.markFailedTerminal(any(), anyInt(), anyInt(), any(), any(), any(), any())).thenReturn(1);
        register((jobId, payload) -> {
            throw new IllegalStateException("boom");
        });

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).markFailedTerminal(eq(job.getId()), eq(2), eq(3), eq("boom"),
                eq(FailureKind.TRANSIENT), any(), any());
    }

    @Test
    void shouldFailMissingPayloadAsValidationError() {
        Job job = activeJob(0, 3);
        job.setPayload(JsonNodeFactory.instance.nullNode());
        when(jobRepository.markFailedTerminal(any(), anyInt(), anyInt(), any(), any(), any(), any())).thenReturn(1);
        register((jobId, payload) -> JobResult.success());

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).markFailedTerminal(eq(job.getId()), eq(0), eq(1), anyString(),
                eq(FailureKind.VALIDATION), any(), any());
    }

    @Test
    void shouldFallBackToEntityUpdateWhenConditionalRetryMatchesNoRow() {
        Job job = activeJob(0, 3);
        when(jobRepository.markForRetry(any(), anyInt(), anyInt(), any(), any(), any(), any(), any())).thenReturn(0);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        register((jobId, payload) -> {
            throw new TransientException("rate limited");
        });

        jobPoller.processJob(job, jobPoller.registrationFor(JobType.SYSTEM_HEALTH));

        verify(jobRepository).save(job);
        assertThat(job.getStatus()).isEqualTo(JobStatus.DELAYED);
        assertThat(job.getAttemptsMade()).isEqualTo(1);
        assertThat(job.getErrorMessage()).isEqualTo("rate limited");
        assertThat(job.getRunAt()).isAfter(OffsetDateTime.now());
    }

    private void register(JobHandler<JobPayloads.SystemTask> handler) {
        jobPoller.registerHandler(JobType.SYSTEM_HEALTH, handler, 1);
    }

    private Job waitingJob() {
        Job job = new Job(UUID.randomUUID(), JobType.SYSTEM_HEALTH,
                JsonNodeFactory.instance.objectNode().put("trigger", "test"), 3, JobPriority.NORMAL,
                BackoffPolicy.exponential(1_000));
        job.setStatus(JobStatus.WAITING);
        job.setRunAt(OffsetDateTime.now());
        return job;
    }

    private Job activeJob(int attemptsMade, int maxAttempts) {
        Job job = new Job(UUID.randomUUID(), JobType.SYSTEM_HEALTH,
                JsonNodeFactory.instance.objectNode().put("trigger", "test"), maxAttempts, JobPriority.NORMAL,
                BackoffPolicy.exponential(1_000));
        job.setStatus(JobStatus.WAITING);
        job.transitionTo(JobStatus.ACTIVE);
        job.setAttemptsMade(attemptsMade);
        job.setLockedAt(OffsetDateTime.now());
        job.setLockedBy(jobPoller.getNodeId());
        return job;
    }
}
