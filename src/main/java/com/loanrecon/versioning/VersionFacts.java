package com.loanrecon.versioning;

import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.LoanDocument;

import java.time.LocalDate;

/**
 * The attributes version ordering looks at, gathered from the document and its oracle judgment.
 */
public record VersionFacts(String documentId,
                           FinalityIndicator finality,
                           boolean signed,
                           LocalDate documentDate,
                           int pageCount) {

    public static VersionFacts of(LoanDocument document, DocumentClassification classification) {
        FinalityIndicator finality = FinalityIndicator.UNKNOWN;
        boolean signed = false;
        LocalDate date = null;
        if (classification != null) {
            finality = classification.getFinality() != null ? classification.getFinality() : FinalityIndicator.UNKNOWN;
            signed = Boolean.TRUE.equals(classification.getHasSignature());
            date = classification.getDocumentDate();
        }
        return new VersionFacts(document.getId(), finality, signed, date, document.getPageCount());
    }
}
