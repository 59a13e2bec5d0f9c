package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Immutable raw document unit, written by the ingestion collaborator. The engine only reads it;
 * fingerprints and oracle judgments live in their own collections keyed by document id.
 */
@Document(collection = "documents")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LoanDocument {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String loanId;
    private String fileName;
    private int pageCount;
    /** Key used by DocumentContentStore to load text and first-page image. */
    private String storageKey;
    private Instant uploadedAt;

    /** True when the 1-based page exists in this document. */
    public boolean hasPage(int page) {
        return page >= 1 && page <= pageCount;
    }
}
