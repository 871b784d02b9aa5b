package com.adpilot.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdPilotPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(AdPilotProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultAdpilotProperties() {
        contextRunner.run(context -> {
            AdPilotProperties properties = context.getBean(AdPilotProperties.class);
            assertTrue(properties.getQueue().isEnabled());
            assertEquals(1000, properties.getQueue().getPollIntervalMs());
            assertEquals(Duration.ofMinutes(30), properties.getQueue().getStuckJobTimeout());
            assertTrue(properties.getQueue().getConcurrency().isEmpty());
            assertFalse(properties.getDatabase().isSkipCreate());
            assertTrue(properties.getScheduler().isRegisterDefaults());
            assertEquals("UTC", properties.getScheduler().getTimezone());
            assertEquals(14, properties.getDecision().getAnalysisWindowDays());
            assertEquals(70, properties.getDecision().getScaleScore());
            assertEquals(30, properties.getDecision().getPauseScore());
            assertEquals(1000, properties.getAbTesting().getMinimumSampleSize());
            assertEquals(0.10, properties.getAbTesting().getSignificanceThreshold());
        });
    }

    @Test
    void shouldMapCustomAdpilotProperties() {
        contextRunner
                .withPropertyValues(
                        "adpilot.queue.poll-interval-ms=250",
                        "adpilot.queue.stuck-job-timeout=10m",
                        "adpilot.queue.concurrency.[marketing:campaign:monitor]=8",
                        "adpilot.database.skip-create=true",
                        "adpilot.scheduler.timezone=Europe/Vienna",
                        "adpilot.scheduler.definitions[0].name=nightly-report",
                        "adpilot.scheduler.definitions[0].cron-expression=0 1 * * *",
                        "adpilot.scheduler.definitions[0].job-type=analytics:report",
                        "adpilot.scheduler.definitions[0].payload.businessId=b1",
                        "adpilot.decision.analysis-window-days=28",
                        "adpilot.ab-testing.minimum-sample-size=500")
                .run(context -> {
                    AdPilotProperties properties = context.getBean(AdPilotProperties.class);
                    assertEquals(250, properties.getQueue().getPollIntervalMs());
                    assertEquals(Duration.ofMinutes(10), properties.getQueue().getStuckJobTimeout());
                    assertEquals(8, properties.getQueue().getConcurrency().get("marketing:campaign:monitor"));
                    assertTrue(properties.getDatabase().isSkipCreate());
                    assertEquals("Europe/Vienna", properties.getScheduler().getTimezone());
                    AdPilotProperties.Definition definition = properties.getScheduler().getDefinitions().get(0);
                    assertEquals("nightly-report", definition.getName());
                    assertEquals("0 1 * * *", definition.getCronExpression());
                    assertEquals("analytics:report", definition.getJobType());
                    assertEquals("b1", definition.getPayload().get("businessId"));
                    assertEquals(28, properties.getDecision().getAnalysisWindowDays());
                    assertEquals(500, properties.getAbTesting().getMinimumSampleSize());
                });
    }
}
