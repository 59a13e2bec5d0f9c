package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Two values agree: numbers within tolerance (default exact), anything else by case-insensitive equality.
 * With useCalculatedValue the first value is the attribute's recomputed value.
 */
@Component
public class ValueMatchEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.VALUE_MATCH;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        String a = logic.getAttribute();
        String b = logic.getOtherAttribute();
        EvidenceBuilder evidence = new EvidenceBuilder(facts).cite(a).cite(b);
        FieldValue other = facts.attribute(b).getValue();
        if (logic.isUseCalculatedValue() || other.asNumber().isPresent()) {
            BigDecimal left = logic.isUseCalculatedValue() ? facts.calculated(a) : facts.number(a);
            if (logic.isUseCalculatedValue()) {
                evidence.steps(facts.trace(a)).value(a + " (calculated)", left.toPlainString());
            }
            BigDecimal right = facts.number(b);
            BigDecimal tolerance = logic.getTolerance() != null ? logic.getTolerance() : BigDecimal.ZERO;
            BigDecimal diff = left.subtract(right).abs();
            String expected = right.toPlainString() + " ± " + tolerance.toPlainString();
            boolean ok = diff.compareTo(tolerance) <= 0;
            return RuleOutcome.of(ok ? ComplianceStatus.PASS : ComplianceStatus.FAIL,
                    a + " " + left.toPlainString() + (ok ? " matches " : " differs from ") + b + " " + right.toPlainString()
                            + " (difference " + diff.toPlainString() + ", tolerance " + tolerance.toPlainString() + ")",
                    expected, left.toPlainString(), evidence.build())
                    .withVariance(diff.toPlainString());
        }
        String left = facts.attribute(a).getValue().display();
        String right = other.display();
        boolean ok = left.trim().toLowerCase(Locale.ROOT).equals(right.trim().toLowerCase(Locale.ROOT));
        return RuleOutcome.of(ok ? ComplianceStatus.PASS : ComplianceStatus.FAIL,
                a + " '" + left + "'" + (ok ? " matches " : " differs from ") + b + " '" + right + "'",
                right, left, evidence.build());
    }
}
