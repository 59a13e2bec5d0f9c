package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * (attribute / otherAttribute) × scale OP threshold, e.g. loan amount over appraised value as LTV percent.
 */
@Component
public class RatioThresholdEvaluator implements RuleLogicEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.RATIO_THRESHOLD;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        BigDecimal numerator = facts.number(logic.getAttribute());
        BigDecimal denominator = facts.number(logic.getOtherAttribute());
        if (denominator.signum() == 0) {
            throw new IllegalStateException(logic.getOtherAttribute() + " is zero");
        }
        BigDecimal scale = logic.getScale() != null ? logic.getScale() : HUNDRED;
        BigDecimal ratio = numerator.multiply(scale)
                .divide(denominator, MathContext.DECIMAL64)
                .setScale(4, RoundingMode.HALF_UP);
        String label = logic.getAttribute() + "/" + logic.getOtherAttribute();
        return Thresholds.judge(logic, ratio, label, new EvidenceBuilder(facts)
                .cite(logic.getAttribute())
                .cite(logic.getOtherAttribute())
                .value(label, ratio.toPlainString())
                .build());
    }
}
