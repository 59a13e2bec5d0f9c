package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audit record: fingerprints said two documents belong together but oracle hints or labels disagreed.
 * The oracle wins; the documents stay in separate groups.
 */
@NoArgsConstructor
@Getter
@Setter
public class GroupingConflict {

    private String documentId;
    private String otherDocumentId;
    private double similarity;
    private String label;
    private String otherLabel;
    private String reason;

    public GroupingConflict(String documentId, String otherDocumentId, double similarity,
                            String label, String otherLabel, String reason) {
        this.documentId = documentId;
        this.otherDocumentId = otherDocumentId;
        this.similarity = similarity;
        this.label = label;
        this.otherLabel = otherLabel;
        this.reason = reason;
    }
}
