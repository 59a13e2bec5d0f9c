package com.loanrecon.domain;

/**
 * Criteria of the version comparator. DOCUMENT_ID is always applied last and guarantees a total order.
 */
public enum VersionCriterion {
    FINALITY,
    SIGNATURE,
    DOCUMENT_DATE,
    PAGE_COUNT,
    DOCUMENT_ID
}
