package com.loanrecon.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/loans/{loanId}/reconciliation/latest response.
 */
public record ReconciliationRunResponse(
        String executionId,
        String status,
        String trigger,
        int retryCount,
        int documentCount,
        int duplicateCount,
        int needsReviewCount,
        int groupCount,
        int attributeCount,
        int unsourcedCount,
        int verificationErrorCount,
        List<String> issues,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {
}
