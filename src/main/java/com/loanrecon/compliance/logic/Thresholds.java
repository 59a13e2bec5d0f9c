package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComparisonOperator;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.EvidenceBundle;
import com.loanrecon.domain.RuleLogic;

import java.math.BigDecimal;

/**
 * Shared operator/threshold judgment: the operator states the compliant condition ({@code actual OP threshold}).
 * A value failing the threshold but meeting the optional warning threshold is a WARNING.
 */
final class Thresholds {

    private Thresholds() {
    }

    static RuleOutcome judge(RuleLogic logic, BigDecimal actual, String label, EvidenceBundle evidence) {
        ComparisonOperator op = logic.getOperator();
        BigDecimal limit = logic.getThreshold();
        if (op == null || limit == null) {
            throw new IllegalArgumentException("Threshold logic needs an operator and a threshold");
        }
        String expected = op.symbol() + " " + limit.toPlainString();
        String actualText = actual.stripTrailingZeros().toPlainString();
        String variance = actual.subtract(limit).stripTrailingZeros().toPlainString();
        if (op.test(actual, limit)) {
            return RuleOutcome.of(ComplianceStatus.PASS, label + " " + actualText + " " + expected,
                    expected, actualText, evidence).withVariance(variance);
        }
        BigDecimal warn = logic.getWarningThreshold();
        if (warn != null && op.test(actual, warn)) {
            return RuleOutcome.of(ComplianceStatus.WARNING, label + " " + actualText + " misses " + expected
                    + " but is within " + op.symbol() + " " + warn.toPlainString(), expected, actualText, evidence)
                    .withVariance(variance);
        }
        return RuleOutcome.of(ComplianceStatus.FAIL, label + " " + actualText + " is not " + expected,
                expected, actualText, evidence).withVariance(variance);
    }
}
