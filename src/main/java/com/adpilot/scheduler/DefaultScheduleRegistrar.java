package com.adpilot.scheduler;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.JobPayloads;
import com.adpilot.queue.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the built-in recurring jobs and the ones declared under {@code adpilot.scheduler.definitions}
 * once the context has started.
 */
@Component
@ConditionalOnProperty(prefix = "adpilot.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DefaultScheduleRegistrar implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleRegistrar.class);

    static final List<DefaultSchedule> DEFAULT_SCHEDULES = List.of(
            new DefaultSchedule("marketing-automation", "0 8 * * *", JobType.MARKETING_AUTOMATION,
                    JobPayloads.MarketingAutomation.allBusinesses()),
            new DefaultSchedule("marketing-monitoring", "0 10 * * *", JobType.CAMPAIGN_MONITOR,
                    new JobPayloads.CampaignMonitor(null, null)),
            new DefaultSchedule("marketing-optimization", "0 14 * * 2,5", JobType.CAMPAIGN_OPTIMIZE,
                    new JobPayloads.CampaignOptimize(null, "scheduled optimization")),
            new DefaultSchedule("abtest-evaluation", "0 */6 * * *", JobType.AB_TEST_EVALUATION,
                    new JobPayloads.AbTestEvaluation(null)),
            new DefaultSchedule("system-cleanup", "0 2 * * *", JobType.SYSTEM_CLEANUP,
                    JobPayloads.SystemTask.scheduled()),
            new DefaultSchedule("health-check", "*/30 * * * *", JobType.SYSTEM_HEALTH,
                    JobPayloads.SystemTask.scheduled()));

    private final JobScheduler jobScheduler;
    private final AdPilotProperties properties;
    private final ObjectMapper objectMapper;
    private volatile boolean running = false;

    public DefaultScheduleRegistrar(JobScheduler jobScheduler, AdPilotProperties properties,
            @Qualifier("adpilotObjectMapper") ObjectMapper objectMapper) {
        this.jobScheduler = jobScheduler;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void start() {
        AdPilotProperties.Scheduler config = properties.getScheduler();
        if (config.isRegisterDefaults()) {
            for (DefaultSchedule schedule : DEFAULT_SCHEDULES) {
                jobScheduler.addScheduledJob(schedule.name(), schedule.cron(), schedule.jobType(), schedule.payload(),
                        ScheduleOptions.defaults());
            }
            log.info("Registered {} default scheduled jobs", DEFAULT_SCHEDULES.size());
        }

        for (AdPilotProperties.Definition definition : config.getDefinitions()) {
            JobType jobType = JobType.fromCode(definition.getJobType());
            Object payload = objectMapper.convertValue(definition.getPayload(), jobType.payloadClass());
            jobScheduler.addScheduledJob(definition.getName(), definition.getCronExpression(), jobType, payload,
                    ScheduleOptions.defaults().withEnabled(definition.isEnabled()));
        }
        if (!config.getDefinitions().isEmpty()) {
            log.info("Registered {} configured scheduled jobs", config.getDefinitions().size());
        }
        this.running = true;
    }

    @Override
    public void stop() {
        jobScheduler.shutdown();
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }

    record DefaultSchedule(String name, String cron, JobType jobType, Object payload) {
    }
}
