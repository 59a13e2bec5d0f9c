package com.loanrecon.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * GET /api/v1/loans/{loanId}/attributes/{name}/trace response. Steps are in evaluation order.
 */
public record CalculationTraceResponse(
        String attributeName,
        String status,
        BigDecimal calculatedValue,
        BigDecimal expectedValue,
        BigDecimal absoluteDifference,
        BigDecimal variancePct,
        String terminalStepId,
        String errorMessage,
        List<Step> steps
) {

    public record Step(
            String stepId,
            int order,
            String kind,
            String description,
            BigDecimal value,
            String documentId,
            Integer page,
            String formula,
            String rationale,
            List<String> parentStepIds
    ) {
    }
}
