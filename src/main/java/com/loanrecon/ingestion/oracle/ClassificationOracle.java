package com.loanrecon.ingestion.oracle;

import com.loanrecon.domain.LoanDocument;
import com.loanrecon.ingestion.content.DocumentContent;

/**
 * External classification/extraction oracle. Implementations may be slow and non-deterministic; callers
 * treat each judgment as an input fact and never call it from the deterministic stages.
 */
public interface ClassificationOracle {

    /**
     * Classify one document and extract its structured fields.
     *
     * @throws TransientOracleException on timeouts, throttling or 5xx; safe to retry
     * @throws OracleException          on malformed responses or rejected requests
     */
    OracleJudgment classify(LoanDocument document, DocumentContent content);
}
