package com.loanrecon.domain;

/**
 * Application event: a reconciliation run finished (COMPLETE or PARTIAL). Triggers a compliance run.
 */
public record ReconciliationCompletedEvent(String loanId, String executionId, ReconciliationRun.RunStatus status) {
}
