package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Content identity of one document: exact hash, perceptual hash and duplicate status.
 * Exact duplicates are kept for audit but excluded from grouping.
 */
@Document(collection = "document_fingerprints")
@CompoundIndex(name = "loan_document", def = "{'loanId': 1, 'documentId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DocumentFingerprint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String documentId;
    private String executionId;
    /** SHA-256 hex. */
    private String exactHash;
    /** 256-bit average hash of the first page, 64 hex chars. */
    private String perceptualHash;
    private FingerprintStatus status;
    /** Set when status=EXACT_DUPLICATE: the canonical document with the same exact hash. */
    private String duplicateOfDocumentId;
    private String failureReason;
    private Instant computedAt;

    public boolean isUsableForGrouping() {
        return status == FingerprintStatus.FINGERPRINTED;
    }

    public enum FingerprintStatus {
        FINGERPRINTED,
        EXACT_DUPLICATE,
        UNFINGERPRINTABLE
    }
}
