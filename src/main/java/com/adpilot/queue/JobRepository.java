package com.adpilot.queue;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Row of a {@code GROUP BY type, status} count.
     */
    interface TypeStatusCount {
        String getType();

        JobStatus getStatus();

        Long getCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM Job j
            WHERE j.type = :type
              AND j.status = com.adpilot.queue.JobStatus.WAITING
              AND j.runAt <= CURRENT_TIMESTAMP
            ORDER BY j.priority DESC, j.createdAt ASC
            """)
    List<Job> findNextJobsForUpdate(@Param("type") String type, Pageable pageable);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = com.adpilot.queue.JobStatus.WAITING,
                j.updatedAt = :now
            WHERE j.status = com.adpilot.queue.JobStatus.DELAYED
              AND j.runAt <= :now
            """)
    int promoteDueDelayedJobs(@Param("now") OffsetDateTime now);

    @Query("""
            SELECT j.type AS type, j.status AS status, COUNT(j) AS count
            FROM Job j
            GROUP BY j.type, j.status
            """)
    List<TypeStatusCount> countByTypeAndStatus();

    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.adpilot.queue.JobStatus.ACTIVE
              AND j.lockedAt < :threshold
            ORDER BY j.lockedAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findStuckJobs(@Param("threshold") OffsetDateTime threshold);

    @Query("""
            SELECT COUNT(j) FROM Job j
            WHERE j.status = com.adpilot.queue.JobStatus.ACTIVE
              AND j.lockedAt < :threshold
            """)
    long countStuckJobs(@Param("threshold") OffsetDateTime threshold);

    @Modifying
    @Transactional
    @Query("DELETE FROM Job j WHERE j.id = :id AND j.status IN :statuses")
    int deleteByIdAndStatusIn(@Param("id") UUID id, @Param("statuses") Collection<JobStatus> statuses);

    @Modifying
    @Transactional
    int deleteByStatusAndFinishedAtBefore(JobStatus status, OffsetDateTime finishedAt);

    @Modifying
    @Transactional
    int deleteByStatusAndFailedAtBefore(JobStatus status, OffsetDateTime failedAt);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.attemptsMade = :nextAttemptsMade,
                j.status = com.adpilot.queue.JobStatus.FAILED,
                j.errorMessage = :errorMessage,
                j.failureKind = :failureKind,
                j.updatedAt = :now,
                j.failedAt = :now,
                j.lockedAt = NULL,
                j.lockedBy = NULL
            WHERE j.id = :id
              AND j.attemptsMade = :expectedAttemptsMade
              AND j.status = com.adpilot.queue.JobStatus.ACTIVE
              AND j.lockedBy = :lockedBy
            """)
    int markFailedTerminal(
            @Param("id") UUID id,
            @Param("expectedAttemptsMade") int expectedAttemptsMade,
            @Param("nextAttemptsMade") int nextAttemptsMade,
            @Param("errorMessage") String errorMessage,
            @Param("failureKind") com.adpilot.error.FailureKind failureKind,
            @Param("now") OffsetDateTime now,
            @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.attemptsMade = :nextAttemptsMade,
                j.status = com.adpilot.queue.JobStatus.DELAYED,
                j.errorMessage = :errorMessage,
                j.failureKind = :failureKind,
                j.updatedAt = :now,
                j.processingStartedAt = NULL,
                j.lockedAt = NULL,
                j.lockedBy = NULL,
                j.runAt = :nextRunAt
            WHERE j.id = :id
              AND j.attemptsMade = :expectedAttemptsMade
              AND j.status = com.adpilot.queue.JobStatus.ACTIVE
              AND j.lockedBy = :lockedBy
            """)
    int markForRetry(
            @Param("id") UUID id,
            @Param("expectedAttemptsMade") int expectedAttemptsMade,
            @Param("nextAttemptsMade") int nextAttemptsMade,
            @Param("errorMessage") String errorMessage,
            @Param("failureKind") com.adpilot.error.FailureKind failureKind,
            @Param("now") OffsetDateTime now,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("lockedBy") String lockedBy);
}
