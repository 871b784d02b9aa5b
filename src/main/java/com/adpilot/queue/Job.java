package com.adpilot.queue;

import com.adpilot.error.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "adpilot_jobs")
public class Job {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String type;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.WAITING;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "processing_started_at")
    private OffsetDateTime processingStartedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    @Column(name = "attempts_made")
    private int attemptsMade = 0;

    @Column(name = "max_attempts")
    private int maxAttempts = 3;

    @Column(name = "priority")
    private int priority = JobPriority.NORMAL.value();

    @Enumerated(EnumType.STRING)
    @Column(name = "backoff_type", nullable = false)
    private BackoffPolicy.Type backoffType = BackoffPolicy.Type.EXPONENTIAL;

    @Column(name = "backoff_delay_ms")
    private long backoffDelayMs = 1000L;

    @Column(name = "run_at")
    private OffsetDateTime runAt;

    public Job() {
        this.runAt = OffsetDateTime.now();
    }

    public Job(UUID id, JobType type, JsonNode payload, int maxAttempts, JobPriority priority,
            BackoffPolicy backoff) {
        this.id = id;
        this.type = type.code();
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.priority = priority.value();
        this.backoffType = backoff.type();
        this.backoffDelayMs = backoff.baseDelayMs();
        this.runAt = OffsetDateTime.now();
    }

    /**
     * Moves the job along its lifecycle, rejecting transitions {@link JobStatus} does not allow.
     */
    public void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        OffsetDateTime now = OffsetDateTime.now();
        switch (next) {
            case ACTIVE -> this.processingStartedAt = now;
            case COMPLETED -> this.finishedAt = now;
            case FAILED -> this.failedAt = now;
            case WAITING, DELAYED -> this.processingStartedAt = null;
        }
        this.status = next;
        this.updatedAt = now;
    }

    @Transient
    public JobType getJobType() {
        return JobType.fromCode(type);
    }

    @Transient
    public BackoffPolicy getBackoff() {
        return new BackoffPolicy(backoffType, backoffDelayMs);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(OffsetDateTime lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public OffsetDateTime getProcessingStartedAt() {
        return processingStartedAt;
    }

    public void setProcessingStartedAt(OffsetDateTime processingStartedAt) {
        this.processingStartedAt = processingStartedAt;
    }

    public OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(FailureKind failureKind) {
        this.failureKind = failureKind;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    public void setAttemptsMade(int attemptsMade) {
        this.attemptsMade = attemptsMade;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public BackoffPolicy.Type getBackoffType() {
        return backoffType;
    }

    public void setBackoffType(BackoffPolicy.Type backoffType) {
        this.backoffType = backoffType;
    }

    public long getBackoffDelayMs() {
        return backoffDelayMs;
    }

    public void setBackoffDelayMs(long backoffDelayMs) {
        this.backoffDelayMs = backoffDelayMs;
    }

    public OffsetDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(OffsetDateTime runAt) {
        this.runAt = runAt;
    }
}
