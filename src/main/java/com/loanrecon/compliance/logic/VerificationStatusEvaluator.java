package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.MissingAttributeException;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

/**
 * The stated value must agree with its recomputation: MATCH → PASS, MINOR_VARIANCE → WARNING, MISMATCH → FAIL.
 * A trace without inputs or with an invalid graph cannot be judged.
 */
@Component
public class VerificationStatusEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.VERIFICATION_STATUS;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        String name = rule.getLogic().getAttribute();
        CalculationTrace t = facts.trace(name);
        String expected = t.getExpectedValue() == null ? null : t.getExpectedValue().toPlainString();
        String actual = t.getCalculatedValue() == null ? null : t.getCalculatedValue().toPlainString();
        ComplianceStatus status = switch (t.getStatus()) {
            case MATCH -> ComplianceStatus.PASS;
            case MINOR_VARIANCE -> ComplianceStatus.WARNING;
            case MISMATCH -> ComplianceStatus.FAIL;
            case MISSING_INPUT -> throw new MissingAttributeException(name,
                    "Calculation for " + name + " is missing inputs: " + t.getErrorMessage());
            case VERIFICATION_ERROR -> throw new IllegalStateException(
                    "Calculation for " + name + " is invalid: " + t.getErrorMessage());
        };
        String message = "Calculated " + name + " " + actual + " vs stated " + expected + ": " + t.getStatus();
        RuleOutcome outcome = RuleOutcome.of(status, message, expected, actual,
                new EvidenceBuilder(facts).cite(name).steps(t).build());
        return t.getVariancePct() != null ? outcome.withVariance(t.getVariancePct().toPlainString() + "%") : outcome;
    }
}
