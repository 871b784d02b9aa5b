package com.adpilot.queue.internal;

import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.BackoffPolicy;
import com.adpilot.queue.JobPriority;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import jakarta.annotation.PostConstruct;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the effective queue settings of each job kind. Precedence, highest first:
 * {@code adpilot.queue.concurrency.<code>}, the {@code @Job} annotation of the worker, the job type defaults.
 */
@Component
public class JobTypeMetadataRegistry {

    private final List<JobWorker<?>> workers;
    private final AdPilotProperties properties;
    private volatile Map<JobType, JobTypeMetadata> metadataByType = Map.of();

    public JobTypeMetadataRegistry(List<JobWorker<?>> workers, AdPilotProperties properties) {
        this.workers = workers;
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        Map<JobType, JobTypeMetadata> metadata = new EnumMap<>(JobType.class);
        for (JobType type : JobType.values()) {
            metadata.put(type, defaultsFor(type));
        }

        for (JobWorker<?> worker : workers) {
            Class<?> workerClass = ClassUtils.getUserClass(worker);
            JobType type = worker.getJobType();
            com.adpilot.queue.annotation.Job annotation = AnnotationUtils.findAnnotation(workerClass,
                    com.adpilot.queue.annotation.Job.class);
            if (annotation == null) {
                continue;
            }
            if (annotation.value() != type) {
                throw new IllegalStateException("JobWorker " + workerClass.getName() + " is annotated with @Job("
                        + annotation.value() + ") but handles " + type);
            }
            metadata.put(type, applyAnnotation(metadata.get(type), annotation, workerClass));
        }

        properties.getQueue().getConcurrency().forEach((code, concurrency) -> {
            JobType type = JobType.fromCode(code);
            if (concurrency == null || concurrency < 1) {
                throw new IllegalStateException("adpilot.queue.concurrency." + code + " must be >= 1");
            }
            JobTypeMetadata current = metadata.get(type);
            metadata.put(type, new JobTypeMetadata(concurrency, current.maxAttempts(), current.backoff(),
                    current.priority()));
        });

        metadataByType = Map.copyOf(metadata);
    }

    public JobTypeMetadata metadataFor(JobType type) {
        JobTypeMetadata metadata = metadataByType.get(type);
        return metadata != null ? metadata : defaultsFor(type);
    }

    public int concurrencyFor(JobType type) {
        return metadataFor(type).concurrency();
    }

    private static JobTypeMetadata defaultsFor(JobType type) {
        JobType.QueueFamily family = type.family();
        return new JobTypeMetadata(type.defaultConcurrency(), family.maxAttempts(), family.backoff(),
                family.priority());
    }

    private static JobTypeMetadata applyAnnotation(JobTypeMetadata current,
            com.adpilot.queue.annotation.Job annotation, Class<?> source) {
        int concurrency = annotation.concurrency() > 0 ? annotation.concurrency() : current.concurrency();
        int maxAttempts = annotation.maxAttempts() > 0 ? annotation.maxAttempts() : current.maxAttempts();
        if (annotation.concurrency() == 0 || annotation.maxAttempts() == 0) {
            throw new IllegalStateException("@Job on " + source.getName()
                    + " must use concurrency and maxAttempts >= 1");
        }
        BackoffPolicy.Type backoffType = annotation.backoffType().length > 0
                ? annotation.backoffType()[0]
                : current.backoff().type();
        long backoffDelayMs = annotation.backoffDelayMs() >= 0
                ? annotation.backoffDelayMs()
                : current.backoff().baseDelayMs();
        JobPriority priority = annotation.priority().length > 0 ? annotation.priority()[0] : current.priority();
        return new JobTypeMetadata(concurrency, maxAttempts, new BackoffPolicy(backoffType, backoffDelayMs),
                priority);
    }

    public record JobTypeMetadata(int concurrency, int maxAttempts, BackoffPolicy backoff, JobPriority priority) {
    }
}
