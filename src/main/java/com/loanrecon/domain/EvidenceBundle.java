package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Documents, values and calculation steps cited by a compliance result.
 */
@NoArgsConstructor
@Getter
@Setter
public class EvidenceBundle {

    private List<CitedDocument> documents = new ArrayList<>();
    private Map<String, String> values = new LinkedHashMap<>();
    private List<CalculationStep> calculationSteps = new ArrayList<>();

    public static EvidenceBundle empty() {
        return new EvidenceBundle();
    }

    public boolean citesDocuments() {
        return documents != null && !documents.isEmpty();
    }

    public boolean isEmpty() {
        return !citesDocuments()
                && (values == null || values.isEmpty())
                && (calculationSteps == null || calculationSteps.isEmpty());
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CitedDocument {
        private String documentId;
        private Integer page;
        private String attributeName;
        private SourceTier sourceTier;

        public CitedDocument(String documentId, Integer page, String attributeName, SourceTier sourceTier) {
            this.documentId = documentId;
            this.page = page;
            this.attributeName = attributeName;
            this.sourceTier = sourceTier;
        }
    }
}
