package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Failure record attributable to a specific document, attribute or rule. Never a bare stack trace.
 */
@NoArgsConstructor
@Getter
@Setter
public class RunIssue {

    private Kind kind;
    private String documentId;
    private Integer page;
    private String attributeName;
    private String ruleCode;
    private String message;

    public static RunIssue forDocument(Kind kind, String documentId, String message) {
        RunIssue issue = new RunIssue();
        issue.setKind(kind);
        issue.setDocumentId(documentId);
        issue.setMessage(message);
        return issue;
    }

    public static RunIssue forAttribute(Kind kind, String attributeName, String documentId, Integer page, String message) {
        RunIssue issue = new RunIssue();
        issue.setKind(kind);
        issue.setAttributeName(attributeName);
        issue.setDocumentId(documentId);
        issue.setPage(page);
        issue.setMessage(message);
        return issue;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.valueOf(kind));
        if (documentId != null) {
            sb.append(" document=").append(documentId);
        }
        if (page != null) {
            sb.append(" page=").append(page);
        }
        if (attributeName != null) {
            sb.append(" attribute=").append(attributeName);
        }
        if (ruleCode != null) {
            sb.append(" rule=").append(ruleCode);
        }
        return sb.append(": ").append(message).toString();
    }

    public enum Kind {
        FINGERPRINT_FAILURE,
        ORACLE_FAILURE,
        GROUPING_CONFLICT,
        UNSOURCED_ATTRIBUTE,
        VERIFICATION_ERROR,
        MISSING_INPUT
    }
}
