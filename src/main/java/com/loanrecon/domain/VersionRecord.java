package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Resolved position of one document within its instrument group.
 */
@NoArgsConstructor
@Getter
@Setter
public class VersionRecord {

    private String documentId;
    /** 0 = master; strict total order within the group. */
    private int rank;
    private Role role;
    /** Criterion that placed this document below the one ranked directly above it; null for rank 0. */
    private VersionCriterion decidedBy;
    /** True when only the document id separated this document from its predecessor (arbitrary but stable). */
    private boolean tieBrokenById;

    public VersionRecord(String documentId, int rank, Role role, VersionCriterion decidedBy, boolean tieBrokenById) {
        this.documentId = documentId;
        this.rank = rank;
        this.role = role;
        this.decidedBy = decidedBy;
        this.tieBrokenById = tieBrokenById;
    }

    public enum Role {
        MASTER,
        SUPERSEDED,
        UNIQUE
    }
}
