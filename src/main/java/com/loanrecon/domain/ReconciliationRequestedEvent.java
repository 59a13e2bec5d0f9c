package com.loanrecon.domain;

/**
 * Application event: a reconciliation run was requested (e.g. POST /loans/{id}/reconciliation).
 * Consumed asynchronously by the reconciliation run service.
 */
public record ReconciliationRequestedEvent(String loanId, String executionId, ReconciliationRun.Trigger trigger) {
}
