package com.adpilot.queue;

import com.adpilot.abtest.AbTest;
import com.adpilot.abtest.AbTestStatus;
import com.adpilot.abtest.AbTestStore;
import com.adpilot.abtest.AbTestType;
import com.adpilot.abtest.AbTestVariant;
import com.adpilot.abtest.SuccessMetric;
import com.adpilot.error.FailureKind;
import com.adpilot.error.PermanentException;
import com.adpilot.error.TransientException;
import com.adpilot.port.AdPlatform;
import com.adpilot.port.MarketingDataStore;
import com.adpilot.port.PlatformAdapter;
import com.adpilot.scheduler.JobScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = JobQueueIntegrationTest.TestApplication.class, properties = {
        "adpilot.queue.poll-interval-ms=100",
        "adpilot.scheduler.register-defaults=false"
})
@Testcontainers(disabledWithoutDocker = true)
class JobQueueIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    static final ConcurrentLinkedQueue<String> backupTriggers = new ConcurrentLinkedQueue<>();
    static final AtomicInteger transientAttempts = new AtomicInteger();

    @Autowired
    JobClient jobClient;

    @Autowired
    JobRepository jobRepository;

    @Autowired
    JobScheduler jobScheduler;

    @Autowired
    AbTestStore abTestStore;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    TransactionTemplate transactionTemplate;

    @SpringBootConfiguration
    @EnableAutoConfiguration
    static class TestApplication {

        @Bean
        MarketingDataStore marketingDataStore() {
            return mock(MarketingDataStore.class);
        }

        @Bean
        PlatformAdapter googleAdsAdapter() {
            PlatformAdapter adapter = mock(PlatformAdapter.class);
            when(adapter.platform()).thenReturn(AdPlatform.GOOGLE_ADS);
            return adapter;
        }

        @Bean
        JobWorker<JobPayloads.SystemTask> backupWorker() {
            return new JobWorker<>() {
                @Override
                public JobType getJobType() {
                    return JobType.SYSTEM_BACKUP;
                }

                @Override
                public JobResult process(UUID jobId, JobPayloads.SystemTask payload) {
                    backupTriggers.add(payload.trigger());
                    return JobResult.success(Map.of("trigger", payload.trigger()));
                }
            };
        }

        @Bean
        JobWorker<JobPayloads.Analytics> analyticsWorker() {
            return new JobWorker<>() {
                @Override
                public JobType getJobType() {
                    return JobType.ANALYTICS_COLLECT;
                }

                @Override
                public JobResult process(UUID jobId, JobPayloads.Analytics payload) {
                    if ("transient".equals(payload.reportType())) {
                        transientAttempts.incrementAndGet();
                        throw new TransientException("Upstream timeout");
                    }
                    if ("permanent".equals(payload.reportType())) {
                        throw new PermanentException("Unknown data source " + payload.dataSource());
                    }
                    return JobResult.success();
                }
            };
        }
    }

    @Test
    void shouldCreateQueueTables() {
        Integer tables = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM information_schema.tables"
                        + " WHERE table_name IN ('adpilot_jobs', 'adpilot_ab_tests')",
                Integer.class);
        assertEquals(2, tables);
        assertEquals(List.of(1, 2), jdbcTemplate.queryForList(
                "SELECT version FROM adpilot_schema_migrations ORDER BY version", Integer.class));
    }

    @Test
    void shouldProcessEnqueuedJobAndStoreResult() {
        UUID jobId = jobClient.enqueue(JobType.SYSTEM_BACKUP, new JobPayloads.SystemTask("manual"));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            Job job = jobRepository.findById(jobId).orElseThrow();
            assertEquals(JobStatus.COMPLETED, job.getStatus());
            assertNotNull(job.getFinishedAt());
            assertEquals("manual", job.getResult().get("trigger").asText());
        });
        assertTrue(backupTriggers.contains("manual"));
    }

    @Test
    void shouldRetryTransientFailureUntilAttemptsAreExhausted() {
        UUID jobId = jobClient.enqueue(JobType.ANALYTICS_COLLECT, analytics("transient"),
                JobOptions.defaults().withMaxAttempts(2).withBackoff(BackoffPolicy.fixed(100)));

        await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            Job job = jobRepository.findById(jobId).orElseThrow();
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals(2, job.getAttemptsMade());
            assertEquals(FailureKind.TRANSIENT, job.getFailureKind());
        });
        assertTrue(transientAttempts.get() >= 2);
    }

    @Test
    void shouldFailPermanentErrorWithoutRetry() {
        UUID jobId = jobClient.enqueue(JobType.ANALYTICS_COLLECT, analytics("permanent"),
                JobOptions.defaults().withMaxAttempts(3));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            Job job = jobRepository.findById(jobId).orElseThrow();
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals(1, job.getAttemptsMade());
            assertEquals(FailureKind.PERMANENT, job.getFailureKind());
            assertTrue(job.getErrorMessage().contains("Unknown data source ga"));
        });
    }

    @Test
    void shouldRunDelayedJobOnlyAfterItIsDue() {
        UUID jobId = jobClient.enqueue(JobType.SYSTEM_BACKUP, new JobPayloads.SystemTask("delayed"),
                JobOptions.defaults().withDelay(Duration.ofSeconds(2)));

        assertEquals(JobStatus.DELAYED, jobRepository.findById(jobId).orElseThrow().getStatus());
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertEquals(JobStatus.COMPLETED, jobRepository.findById(jobId).orElseThrow().getStatus()));
    }

    @Test
    void shouldClaimByPriorityThenInEnqueueOrder() {
        // analytics:report has no worker, so nothing consumes these jobs
        UUID low = enqueueReport(JobPriority.LOW);
        UUID firstNormal = enqueueReport(JobPriority.NORMAL);
        UUID critical = enqueueReport(JobPriority.CRITICAL);
        UUID high = enqueueReport(JobPriority.HIGH);
        UUID secondNormal = enqueueReport(JobPriority.NORMAL);

        List<UUID> claimOrder = transactionTemplate.execute(status -> jobRepository
                .findNextJobsForUpdate(JobType.ANALYTICS_REPORT.code(), PageRequest.of(0, 10))
                .stream()
                .map(Job::getId)
                .toList());

        assertEquals(List.of(critical, high, firstNormal, secondNormal, low), claimOrder);
    }

    @Test
    void shouldEnqueueJobsFromCronTrigger() {
        jobScheduler.addScheduledJob("backup-every-second", "* * * * * *", JobType.SYSTEM_BACKUP,
                new JobPayloads.SystemTask("cron"), null);
        try {
            await().atMost(Duration.ofSeconds(10)).until(() -> backupTriggers.contains("cron"));
        } finally {
            assertTrue(jobScheduler.removeScheduledJob("backup-every-second"));
        }
    }

    @Test
    void shouldPersistAbTestAndGuardConclusionByStatus() {
        OffsetDateTime startedAt = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        AbTest test = new AbTest("test-" + UUID.randomUUID(), "c1", AbTestType.CREATIVE,
                List.of(new AbTestVariant("variant_1", "Control", null, Map.of("headline", "A"), 50, null),
                        new AbTestVariant("variant_2", "Bold", null, Map.of("headline", "B"), 50, null)),
                SuccessMetric.CTR, 14, 1000, AbTestStatus.RUNNING, null, null, null, null, startedAt, null);
        abTestStore.insert(test);

        AbTest stored = abTestStore.findById(test.testId()).orElseThrow();
        assertEquals(List.of(50.0, 50.0), stored.trafficSplit());
        assertEquals("A", stored.variant("variant_1").config().get("headline"));
        assertTrue(abTestStore.findRunning().stream().anyMatch(running -> running.testId().equals(test.testId())));

        AbTest concluded = stored.concluded(AbTestStatus.COMPLETED, true, 0.9, "variant_2", null,
                startedAt.plusDays(14));
        assertTrue(abTestStore.replaceIfStatus(concluded, AbTestStatus.RUNNING));
        assertFalse(abTestStore.replaceIfStatus(concluded, AbTestStatus.RUNNING));
        assertEquals("variant_2", abTestStore.findById(test.testId()).orElseThrow().winningVariantId());
    }

    private UUID enqueueReport(JobPriority priority) {
        return jobClient.enqueue(JobType.ANALYTICS_REPORT, analytics(priority.name()),
                JobOptions.defaults().withPriority(priority));
    }

    private static JobPayloads.Analytics analytics(String reportType) {
        return new JobPayloads.Analytics("b1", "ga", LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 7),
                List.of("clicks"), reportType);
    }
}
