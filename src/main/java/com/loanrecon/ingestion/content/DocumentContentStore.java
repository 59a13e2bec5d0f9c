package com.loanrecon.ingestion.content;

import com.loanrecon.domain.LoanDocument;

import java.util.Optional;

/**
 * Read access to document content owned by the surrounding application.
 */
public interface DocumentContentStore {

    /**
     * @return content, or empty when the store has neither text nor image for the document
     */
    Optional<DocumentContent> load(LoanDocument document);
}
