package com.adpilot.scheduler;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.error.ValidationException;
import com.adpilot.queue.JobClient;
import com.adpilot.queue.JobOptions;
import com.adpilot.queue.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Named cron triggers that enqueue a job each time they fire. Triggers can be added, stopped, restarted
 * and removed at runtime; unknown names are reported with {@code false}, never an exception.
 */
@Service
@ConditionalOnProperty(prefix = "adpilot.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobScheduler implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobClient jobClient;
    private final TaskScheduler taskScheduler;
    private final ZoneId defaultZone;
    private final ThreadPoolTaskScheduler ownedScheduler;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Autowired
    public JobScheduler(JobClient jobClient, AdPilotProperties properties) {
        this.jobClient = jobClient;
        this.defaultZone = resolveZone(properties.getScheduler().getTimezone());
        this.ownedScheduler = new ThreadPoolTaskScheduler();
        this.ownedScheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
        this.ownedScheduler.setThreadNamePrefix("adpilot-scheduler-");
        this.ownedScheduler.initialize();
        this.taskScheduler = ownedScheduler;
    }

    JobScheduler(JobClient jobClient, TaskScheduler taskScheduler, ZoneId defaultZone) {
        this.jobClient = jobClient;
        this.taskScheduler = taskScheduler;
        this.defaultZone = defaultZone;
        this.ownedScheduler = null;
    }

    /**
     * Adds or replaces a trigger. A previous trigger with the same name is stopped first.
     *
     * @param cronExpression five-field (minute precision) or six-field Spring cron expression
     * @throws ValidationException for an invalid cron expression, time zone or payload
     */
    public ScheduledJobDefinition addScheduledJob(String name, String cronExpression, JobType jobType, Object payload,
            ScheduleOptions options) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Scheduled job name must not be blank");
        }
        if (jobType == null) {
            throw new ValidationException("Scheduled job '" + name + "' needs a job type");
        }
        if (payload == null || !jobType.payloadClass().isInstance(payload)) {
            throw new ValidationException("Scheduled job '" + name + "' needs a " + jobType.payloadClass().getSimpleName()
                    + " payload");
        }
        ScheduleOptions resolvedOptions = options != null ? options : ScheduleOptions.defaults();
        String normalizedCron = normalizeCron(cronExpression);
        ZoneId zone = resolvedOptions.timezone() != null ? resolveZone(resolvedOptions.timezone()) : defaultZone;

        ScheduledJobDefinition definition = new ScheduledJobDefinition(name.trim(), normalizedCron, jobType, payload,
                resolvedOptions.enabled(), zone.getId(), resolvedOptions.priority());
        Entry entry = new Entry(definition, new CronTrigger(normalizedCron, zone));

        Entry previous = entries.put(definition.name(), entry);
        if (previous != null) {
            previous.cancel();
            log.info("Replaced scheduled job '{}'", definition.name());
        }
        if (definition.enabled()) {
            start(entry);
        }
        log.info("Scheduled job '{}' ({}) with cron '{}' in {}, enabled={}", definition.name(), jobType,
                normalizedCron, zone.getId(), definition.enabled());
        return definition;
    }

    public boolean removeScheduledJob(String name) {
        Entry entry = name == null ? null : entries.remove(name);
        if (entry == null) {
            log.warn("Cannot remove scheduled job '{}': not found", name);
            return false;
        }
        entry.cancel();
        log.info("Removed scheduled job '{}'", name);
        return true;
    }

    public boolean startJob(String name) {
        Entry entry = name == null ? null : entries.get(name);
        if (entry == null) {
            log.warn("Cannot start scheduled job '{}': not found", name);
            return false;
        }
        if (entry.isRunning()) {
            log.debug("Scheduled job '{}' is already running", name);
            return true;
        }
        start(entry);
        log.info("Started scheduled job '{}'", name);
        return true;
    }

    public boolean stopJob(String name) {
        Entry entry = name == null ? null : entries.get(name);
        if (entry == null) {
            log.warn("Cannot stop scheduled job '{}': not found", name);
            return false;
        }
        entry.cancel();
        log.info("Stopped scheduled job '{}'", name);
        return true;
    }

    public List<ScheduledJobState> getScheduledJobs() {
        return entries.values().stream()
                .map(entry -> new ScheduledJobState(entry.definition, entry.isRunning(), entry.nextExecution()))
                .sorted(Comparator.comparing(state -> state.definition().name()))
                .toList();
    }

    /**
     * Stops every trigger. Definitions stay listed and can be restarted.
     */
    public void shutdown() {
        entries.values().forEach(Entry::cancel);
        log.info("Stopped {} scheduled job(s)", entries.size());
    }

    @Override
    public void destroy() {
        shutdown();
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
    }

    /**
     * Enqueues one job for the named trigger. Failures are logged so that the trigger keeps firing.
     */
    void fire(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            return;
        }
        ScheduledJobDefinition definition = entry.definition;
        try {
            JobOptions options = definition.priority() != null
                    ? JobOptions.defaults().withPriority(definition.priority())
                    : JobOptions.defaults();
            jobClient.enqueue(definition.jobType(), definition.payload(), options);
            log.debug("Scheduled job '{}' fired", name);
        } catch (RuntimeException e) {
            log.error("Scheduled job '{}' failed to enqueue {}", name, definition.jobType(), e);
        }
    }

    static String normalizeCron(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new ValidationException("Cron expression must not be blank");
        }
        String trimmed = cronExpression.trim().replaceAll("\\s+", " ");
        int fields = trimmed.split(" ").length;
        String normalized = switch (fields) {
            case 5 -> "0 " + trimmed;
            case 6 -> trimmed;
            default -> throw new ValidationException("Invalid cron expression '" + cronExpression
                    + "': expected 5 or 6 fields, got " + fields);
        };
        try {
            CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + cronExpression + "'", e);
        }
        return normalized;
    }

    private static ZoneId resolveZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown time zone '" + timezone + "'", e);
        }
    }

    private void start(Entry entry) {
        String name = entry.definition.name();
        entry.future = taskScheduler.schedule(() -> fire(name), entry.trigger);
    }

    private static final class Entry {
        private final ScheduledJobDefinition definition;
        private final CronTrigger trigger;
        private volatile ScheduledFuture<?> future;

        private Entry(ScheduledJobDefinition definition, CronTrigger trigger) {
            this.definition = definition;
            this.trigger = trigger;
        }

        private boolean isRunning() {
            ScheduledFuture<?> current = future;
            return current != null && !current.isCancelled();
        }

        private void cancel() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
            future = null;
        }

        private ZonedDateTime nextExecution() {
            if (!isRunning()) {
                return null;
            }
            ZonedDateTime now = ZonedDateTime.now(ZoneId.of(definition.timezone()));
            return CronExpression.parse(definition.cronExpression()).next(now);
        }
    }
}
