package com.loanrecon.domain;

/**
 * Application event: compliance re-evaluation requested against the latest reconciled record.
 */
public record ComplianceRequestedEvent(String loanId) {
}
