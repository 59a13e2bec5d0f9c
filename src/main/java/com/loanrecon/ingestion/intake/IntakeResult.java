package com.loanrecon.ingestion.intake;

import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentFingerprint;

import java.util.Map;

/**
 * Output of document intake keyed by document id. Classifications exist only for canonical,
 * fingerprinted documents.
 */
public record IntakeResult(Map<String, DocumentFingerprint> fingerprints,
                           Map<String, DocumentClassification> classifications) {

    public long count(DocumentFingerprint.FingerprintStatus status) {
        return fingerprints.values().stream().filter(f -> f.getStatus() == status).count();
    }

    public long needsReviewCount() {
        return classifications.values().stream().filter(c -> !c.isClassified()).count();
    }
}
