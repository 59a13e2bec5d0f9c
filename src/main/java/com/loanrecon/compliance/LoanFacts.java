package com.loanrecon.compliance;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.Loan;
import com.loanrecon.domain.ReconciledAttribute;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one loan's reconciled record handed to rule evaluators.
 */
public final class LoanFacts {

    private final Loan loan;
    private final Map<String, ReconciledAttribute> attributes;
    private final Map<String, CalculationTrace> traces;
    private final LocalDate evaluationDate;

    public LoanFacts(Loan loan, Map<String, ReconciledAttribute> attributes,
                     Map<String, CalculationTrace> traces, LocalDate evaluationDate) {
        this.loan = loan;
        this.attributes = Map.copyOf(attributes);
        this.traces = Map.copyOf(traces);
        this.evaluationDate = evaluationDate;
    }

    public Loan loan() {
        return loan;
    }

    /** Loan application date, or the evaluation date when the loan has none. */
    public LocalDate applicabilityDate() {
        return loan.getApplicationDate() != null ? loan.getApplicationDate() : evaluationDate;
    }

    public Optional<ReconciledAttribute> find(String name) {
        return Optional.ofNullable(name == null ? null : attributes.get(name));
    }

    /**
     * @throws MissingAttributeException when absent or unsourced
     */
    public ReconciledAttribute attribute(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Rule logic names no attribute");
        }
        ReconciledAttribute a = attributes.get(name);
        if (a == null || !a.hasValue()) {
            throw new MissingAttributeException(name, "Attribute " + name + " has no sourced value");
        }
        return a;
    }

    public BigDecimal number(String name) {
        return attribute(name).getValue().asNumber()
                .orElseThrow(() -> new IllegalStateException("Attribute " + name + " is not numeric"));
    }

    public LocalDate date(String name) {
        return attribute(name).getValue().asDate()
                .orElseThrow(() -> new IllegalStateException("Attribute " + name + " is not a date"));
    }

    public boolean bool(String name) {
        return attribute(name).getValue().asBool()
                .orElseThrow(() -> new IllegalStateException("Attribute " + name + " is not a yes/no value"));
    }

    /**
     * @throws MissingAttributeException when no trace was built for the attribute
     */
    public CalculationTrace trace(String name) {
        CalculationTrace t = traces.get(name);
        if (t == null) {
            throw new MissingAttributeException(name, "No calculation trace for " + name);
        }
        return t;
    }

    /**
     * Calculated value of the attribute's trace.
     *
     * @throws MissingAttributeException when the trace has no calculated value
     */
    public BigDecimal calculated(String name) {
        BigDecimal v = trace(name).getCalculatedValue();
        if (v == null) {
            throw new MissingAttributeException(name, "Calculation for " + name + " has no value ("
                    + trace(name).getStatus() + ")");
        }
        return v;
    }
}
