package com.adpilot.worker;

import com.adpilot.abtest.AbTestReview;
import com.adpilot.execution.ExecutionResult;
import com.adpilot.marketing.BusinessDecision;

import java.util.List;
import java.util.Map;

/**
 * Result stored on a completed {@code marketing:automation} job.
 *
 * @param abTestErrors     campaign id to error message, for campaigns whose A/B tests could not be reviewed
 * @param failedBusinesses business id to error message, for businesses that could not be evaluated
 */
public record AutomationReport(
        int businessesAnalyzed,
        List<BusinessDecision> decisions,
        Map<String, List<ExecutionResult>> executionResults,
        List<AbTestReview> abTestResults,
        Map<String, String> abTestErrors,
        Map<String, String> failedBusinesses,
        ExecutiveSummary summary) {
}
