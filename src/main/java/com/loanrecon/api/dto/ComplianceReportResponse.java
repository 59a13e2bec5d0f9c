package com.loanrecon.api.dto;

import com.loanrecon.domain.EvidenceBundle;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/loans/{loanId}/compliance response: latest execution summary and its per-rule results.
 */
public record ComplianceReportResponse(
        String executionId,
        String reconciliationExecutionId,
        String overallStatus,
        Map<String, Integer> counts,
        Instant completedAt,
        List<Result> results
) {

    public record Result(
            String ruleCode,
            String ruleName,
            String category,
            String severity,
            String status,
            String message,
            String expectedValue,
            String actualValue,
            String variance,
            boolean requiresManualReview,
            String remediationGuidance,
            EvidenceBundle evidence
    ) {
    }
}
