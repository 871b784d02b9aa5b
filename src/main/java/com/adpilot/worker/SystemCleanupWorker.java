package com.adpilot.worker;

import com.adpilot.queue.JobPayloads.SystemTask;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import com.adpilot.queue.internal.JobCleaner;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@Job(JobType.SYSTEM_CLEANUP)
public class SystemCleanupWorker implements JobWorker<SystemTask> {

    private final JobCleaner jobCleaner;

    public SystemCleanupWorker(JobCleaner jobCleaner) {
        this.jobCleaner = jobCleaner;
    }

    @Override
    public JobResult process(UUID jobId, SystemTask payload) {
        return JobResult.success(jobCleaner.cleanup());
    }
}
