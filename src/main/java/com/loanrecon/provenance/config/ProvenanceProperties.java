package com.loanrecon.provenance.config;

import com.loanrecon.domain.CalculationStep;
import com.loanrecon.provenance.Formula;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculation recipes for derived attributes and the verification tolerances.
 */
@ConfigurationProperties(prefix = "loanrecon.provenance")
@NoArgsConstructor
@Getter
@Setter
public class ProvenanceProperties {

    /** |calculated - expected| below this is a MATCH. Default 0.10 (ten cents). */
    private BigDecimal epsilonAbs = new BigDecimal("0.10");

    /** Variance (percent of expected) below this is a MINOR_VARIANCE. Default 0.5. */
    private BigDecimal epsilonPct = new BigDecimal("0.5");

    private List<CalculationRecipe> calculations = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CalculationRecipe {

        /** Derived attribute this recipe recomputes; also the trace key. */
        private String attribute;
        /** Attribute holding the authoritative value to verify against. Defaults to {@link #attribute}. */
        private String expectedAttribute;
        private List<StepDefinition> steps = new ArrayList<>();

        public String effectiveExpectedAttribute() {
            return expectedAttribute != null && !expectedAttribute.isBlank() ? expectedAttribute : attribute;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class StepDefinition {

        private String id;
        private CalculationStep.Kind kind;
        private String description;
        /** SOURCE: reconciled attribute to read. */
        private String attribute;
        /** SOURCE alternative: field of the master document of this instrument type. */
        private String instrumentType;
        private String fieldKey;
        /** FORMULA only. */
        private Formula formula;
        private List<String> parents = new ArrayList<>();
        /** PERCENTAGE rate or ADJUSTMENT multiplier. */
        private BigDecimal factor;
        /** ADJUSTMENT only: policy justification, e.g. "2-year income averaging". */
        private String rationale;
    }
}
