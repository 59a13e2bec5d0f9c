package com.loanrecon.domain;

/**
 * Which level of the fallback chain supplied an attribute.
 */
public enum SourceTier {
    /** First instrument type of the chain (e.g. transmittal summary). */
    PRIMARY,
    /** Any later instrument type of the chain. */
    FALLBACK,
    /** Reviewer-entered value citing a document. */
    MANUAL
}
