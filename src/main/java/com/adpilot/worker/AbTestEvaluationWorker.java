package com.adpilot.worker;

import com.adpilot.abtest.AbTestReview;
import com.adpilot.abtest.AbTestingEngine;
import com.adpilot.queue.JobPayloads.AbTestEvaluation;
import com.adpilot.queue.JobResult;
import com.adpilot.queue.JobType;
import com.adpilot.queue.JobWorker;
import com.adpilot.queue.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@Job(JobType.AB_TEST_EVALUATION)
public class AbTestEvaluationWorker implements JobWorker<AbTestEvaluation> {

    private static final Logger log = LoggerFactory.getLogger(AbTestEvaluationWorker.class);

    private final AbTestingEngine abTestingEngine;

    public AbTestEvaluationWorker(AbTestingEngine abTestingEngine) {
        this.abTestingEngine = abTestingEngine;
    }

    @Override
    public JobResult process(UUID jobId, AbTestEvaluation payload) {
        List<AbTestReview> reviews = abTestingEngine.reviewRunningTests(payload.campaignId());
        long concluded = reviews.stream().filter(review -> review.action() == AbTestReview.Action.CONCLUDE).count();
        log.info("Reviewed {} running A/B test(s), concluded {}", reviews.size(), concluded);
        return JobResult.success(reviews);
    }
}
