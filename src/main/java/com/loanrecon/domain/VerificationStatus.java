package com.loanrecon.domain;

/**
 * Outcome of comparing a DAG's terminal value against the authoritative attribute value.
 */
public enum VerificationStatus {
    MATCH,
    MINOR_VARIANCE,
    MISMATCH,
    /** A source value or the authoritative value is missing; never treated as zero. */
    MISSING_INPUT,
    /** DAG construction failed (cycle, dangling reference, non-existent page). */
    VERIFICATION_ERROR
}
