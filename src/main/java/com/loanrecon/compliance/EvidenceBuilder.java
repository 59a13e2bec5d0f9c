package com.loanrecon.compliance;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.EvidenceBundle;
import com.loanrecon.domain.ReconciledAttribute;

import java.util.ArrayList;

/**
 * Collects cited documents, values and calculation steps for one rule evaluation.
 */
public final class EvidenceBuilder {

    private final LoanFacts facts;
    private final EvidenceBundle bundle = new EvidenceBundle();

    public EvidenceBuilder(LoanFacts facts) {
        this.facts = facts;
    }

    /** Cites the attribute's source document and page when it has a value; no-op otherwise. */
    public EvidenceBuilder cite(String attributeName) {
        facts.find(attributeName).filter(ReconciledAttribute::hasValue).ifPresent(a -> {
            boolean alreadyCited = bundle.getDocuments().stream()
                    .anyMatch(d -> attributeName.equals(d.getAttributeName()));
            if (!alreadyCited) {
                bundle.getDocuments().add(new EvidenceBundle.CitedDocument(
                        a.getSourceDocumentId(), a.getSourcePage(), a.getName(), a.getSourceTier()));
            }
            bundle.getValues().put(attributeName, a.getValue().display());
        });
        return this;
    }

    public EvidenceBuilder value(String key, Object value) {
        bundle.getValues().put(key, value == null ? null : String.valueOf(value));
        return this;
    }

    /** Adds the trace's steps and cites every document a SOURCE step read from. */
    public EvidenceBuilder steps(CalculationTrace trace) {
        if (trace == null || trace.getSteps() == null) {
            return this;
        }
        bundle.setCalculationSteps(new ArrayList<>(trace.getSteps()));
        trace.getSteps().stream()
                .filter(s -> s.getDocumentId() != null)
                .forEach(s -> bundle.getDocuments().add(new EvidenceBundle.CitedDocument(
                        s.getDocumentId(), s.getPage(), trace.getAttributeName() + "/" + s.getStepId(), null)));
        return this;
    }

    public EvidenceBundle build() {
        return bundle;
    }
}
