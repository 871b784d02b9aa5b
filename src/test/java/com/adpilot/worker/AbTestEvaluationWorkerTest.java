package com.adpilot.worker;

import com.adpilot.abtest.AbTestReview;
import com.adpilot.abtest.AbTestStatus;
import com.adpilot.abtest.AbTestingEngine;
import com.adpilot.queue.JobPayloads.AbTestEvaluation;
import com.adpilot.queue.JobResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AbTestEvaluationWorkerTest {

    private final AbTestingEngine engine = mock(AbTestingEngine.class);
    private final AbTestEvaluationWorker worker = new AbTestEvaluationWorker(engine);

    @Test
    void shouldReturnReviewsOfRunningTests() {
        List<AbTestReview> reviews = List.of(
                new AbTestReview("ab_c1_1", "c1", AbTestReview.Action.CONCLUDE, AbTestStatus.COMPLETED,
                        "variant_2", 0.9, "Implement variant_2"),
                new AbTestReview("ab_c1_2", "c1", AbTestReview.Action.CONTINUE, AbTestStatus.RUNNING,
                        null, 0.4, "Keep collecting data"));
        when(engine.reviewRunningTests("c1")).thenReturn(reviews);

        JobResult result = worker.process(UUID.randomUUID(), new AbTestEvaluation("c1"));

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUCCEEDED);
        assertThat(result.getData()).isEqualTo(reviews);
    }

    @Test
    void shouldReviewEveryCampaignWhenUnscoped() {
        when(engine.reviewRunningTests(null)).thenReturn(List.of());

        JobResult result = worker.process(UUID.randomUUID(), new AbTestEvaluation(null));

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUCCEEDED);
        assertThat(result.getData()).isEqualTo(List.of());
    }
}
