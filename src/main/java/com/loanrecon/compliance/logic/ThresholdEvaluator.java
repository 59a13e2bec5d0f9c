package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * attribute OP threshold, on the reconciled value or (useCalculatedValue) the recomputed one.
 */
@Component
public class ThresholdEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.THRESHOLD;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        String name = logic.getAttribute();
        EvidenceBuilder evidence = new EvidenceBuilder(facts).cite(name);
        BigDecimal actual;
        if (logic.isUseCalculatedValue()) {
            actual = facts.calculated(name);
            evidence.steps(facts.trace(name)).value(name + " (calculated)", actual.toPlainString());
        } else {
            actual = facts.number(name);
        }
        return Thresholds.judge(logic, actual, name, evidence.build());
    }
}
