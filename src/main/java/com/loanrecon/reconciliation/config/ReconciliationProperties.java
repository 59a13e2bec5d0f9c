package com.loanrecon.reconciliation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Attribute definitions, the default instrument-type fallback chain and scheduled retry of PARTIAL runs.
 */
@ConfigurationProperties(prefix = "loanrecon.reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Instrument types consulted in order; index 0 is the PRIMARY tier, later entries FALLBACK. */
    private List<String> defaultChain = new ArrayList<>(List.of(
            "transmittal_summary", "application_form", "non_standard_application"));

    /** Consult reviewer-entered values after the chain is exhausted. Default true. */
    private boolean manualTierEnabled = true;

    private List<AttributeDefinition> attributes = new ArrayList<>();

    /** How often (ms) PartialRunRetryJob looks for loans whose latest run is PARTIAL due to oracle failures. */
    private long retryIntervalMs = 900_000;

    /** Max scheduled re-runs per loan before a PARTIAL run is left for manual review. */
    private int maxPartialRetries = 3;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class AttributeDefinition {

        private String name;
        private String unit;
        /** Oracle field keys that carry this attribute, tried in order. Defaults to the attribute name. */
        private List<String> fieldKeys = new ArrayList<>();
        /** Overrides the default chain for this attribute when non-empty. */
        private List<String> chain = new ArrayList<>();

        public List<String> effectiveFieldKeys() {
            return fieldKeys == null || fieldKeys.isEmpty() ? List.of(name) : fieldKeys;
        }
    }
}
