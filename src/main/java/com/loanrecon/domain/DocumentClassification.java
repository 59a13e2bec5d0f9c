package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Oracle judgment for one document, already coerced to typed values.
 * NEEDS_REVIEW documents (retries exhausted) are excluded from grouping and versioning for the run.
 */
@Document(collection = "document_classifications")
@CompoundIndex(name = "loan_document", def = "{'loanId': 1, 'documentId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DocumentClassification {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String documentId;
    private String executionId;
    /** Exact hash of the content the judgment was made for; a changed hash invalidates reuse. */
    private String exactHash;
    private ClassificationStatus status;
    private String typeLabel;
    private String groupingHint;
    private FinalityIndicator finality = FinalityIndicator.UNKNOWN;
    private Boolean hasSignature;
    private LocalDate documentDate;
    private Map<String, ExtractedField> fields = new LinkedHashMap<>();
    private int attempts;
    private String failureReason;
    private Instant classifiedAt;

    public boolean isClassified() {
        return status == ClassificationStatus.CLASSIFIED;
    }

    /** Field lookup by key; blank or absent fields are empty. */
    public Optional<ExtractedField> field(String key) {
        if (fields == null || key == null) {
            return Optional.empty();
        }
        ExtractedField f = fields.get(key);
        return f != null && f.hasValue() ? Optional.of(f) : Optional.empty();
    }

    public enum ClassificationStatus {
        CLASSIFIED,
        NEEDS_REVIEW
    }
}
