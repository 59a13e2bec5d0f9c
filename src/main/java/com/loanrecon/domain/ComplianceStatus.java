package com.loanrecon.domain;

/**
 * Exactly one of these per (loan, rule, execution).
 * ERROR means the data was incomplete or the rule could not run; FAIL means a genuine violation.
 */
public enum ComplianceStatus {
    PASS,
    FAIL,
    WARNING,
    NA,
    ERROR,
    PENDING_REVIEW
}
