package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.JobRepository;
import com.adpilot.queue.JobStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobCleanerTest {

    private final JobRepository jobRepository = mock(JobRepository.class);
    private final AdPilotProperties properties = new AdPilotProperties();
    private final JobCleaner cleaner = new JobCleaner(jobRepository, properties);

    @Test
    void shouldDeleteFinishedJobsPastTheirRetention() {
        when(jobRepository.deleteByStatusAndFinishedAtBefore(eq(JobStatus.COMPLETED), any())).thenReturn(4);
        when(jobRepository.deleteByStatusAndFailedAtBefore(eq(JobStatus.FAILED), any())).thenReturn(1);

        OffsetDateTime before = OffsetDateTime.now();
        JobCleaner.CleanupReport report = cleaner.cleanup();

        assertThat(report).isEqualTo(new JobCleaner.CleanupReport(4, 1));
        ArgumentCaptor<OffsetDateTime> completedCutoff = ArgumentCaptor.forClass(OffsetDateTime.class);
        ArgumentCaptor<OffsetDateTime> failedCutoff = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(jobRepository).deleteByStatusAndFinishedAtBefore(eq(JobStatus.COMPLETED), completedCutoff.capture());
        verify(jobRepository).deleteByStatusAndFailedAtBefore(eq(JobStatus.FAILED), failedCutoff.capture());
        assertThat(completedCutoff.getValue()).isBeforeOrEqualTo(OffsetDateTime.now().minusHours(24))
                .isAfterOrEqualTo(before.minusHours(24));
        assertThat(failedCutoff.getValue()).isBeforeOrEqualTo(OffsetDateTime.now().minusDays(7))
                .isAfterOrEqualTo(before.minusDays(7));
    }

    @Test
    void shouldKeepJobsWhenRetentionIsDisabled() {
        properties.getQueue().setDeleteCompletedJobsAfter(null);
        properties.getQueue().setDeleteFailedJobsAfter(Duration.ofDays(1));

        JobCleaner.CleanupReport report = cleaner.cleanup();

        assertThat(report.deletedCompleted()).isZero();
        verify(jobRepository, never()).deleteByStatusAndFinishedAtBefore(any(), any());
        verify(jobRepository).deleteByStatusAndFailedAtBefore(eq(JobStatus.FAILED), any());
    }
}
