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
 * One named scalar of the loan record with its winning source.
 * Invariant: a non-missing value has sourceDocumentId and sourceTier; an unsourced attribute has a MISSING value.
 */
@Document(collection = "reconciled_attributes")
@CompoundIndex(name = "loan_name", def = "{'loanId': 1, 'name': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReconciledAttribute {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String executionId;
    private String name;
    private FieldValue value = FieldValue.missing();
    private String unit;
    private String sourceDocumentId;
    private Integer sourcePage;
    private SourceTier sourceTier;
    /** Position in the chain that won (0-based); chain length for MANUAL. */
    private Integer sourceTierIndex;
    private String sourceInstrumentType;
    private boolean unsourced;
    private Instant reconciledAt;

    public static ReconciledAttribute unsourced(String loanId, String executionId, String name, String unit) {
        ReconciledAttribute a = new ReconciledAttribute();
        a.setId(loanId + ":" + name);
        a.setLoanId(loanId);
        a.setExecutionId(executionId);
        a.setName(name);
        a.setUnit(unit);
        a.setValue(FieldValue.missing());
        a.setUnsourced(true);
        a.setReconciledAt(Instant.now());
        return a;
    }

    public boolean hasValue() {
        return !unsourced && value != null && !value.isMissing();
    }

    public boolean isFallbackSourced() {
        return sourceTier == SourceTier.FALLBACK || sourceTier == SourceTier.MANUAL;
    }
}
