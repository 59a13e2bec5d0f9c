package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Provenance DAG for one derived attribute plus its verification against the authoritative value.
 */
@Document(collection = "calculation_traces")
@CompoundIndex(name = "loan_attribute", def = "{'loanId': 1, 'attributeName': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CalculationTrace {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String executionId;
    private String attributeName;
    private List<CalculationStep> steps = new ArrayList<>();
    private String terminalStepId;
    private BigDecimal calculatedValue;
    private BigDecimal expectedValue;
    private BigDecimal absoluteDifference;
    private BigDecimal variancePct;
    private VerificationStatus status;
    private String errorMessage;
    private Instant builtAt;

    public Optional<CalculationStep> terminalStep() {
        if (terminalStepId == null || steps == null) {
            return Optional.empty();
        }
        return steps.stream().filter(s -> terminalStepId.equals(s.getStepId())).findFirst();
    }
}
