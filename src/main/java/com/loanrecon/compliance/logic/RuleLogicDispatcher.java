package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a rule to the evaluator registered for its logic type.
 */
@Component
public class RuleLogicDispatcher {

    private final Map<RuleLogic.LogicType, RuleLogicEvaluator> evaluators = new EnumMap<>(RuleLogic.LogicType.class);

    public RuleLogicDispatcher(List<RuleLogicEvaluator> evaluators) {
        for (RuleLogicEvaluator e : evaluators) {
            if (this.evaluators.put(e.type(), e) != null) {
                throw new IllegalStateException("Two evaluators registered for " + e.type());
            }
        }
    }

    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        if (logic == null || logic.getType() == null) {
            throw new IllegalArgumentException("Rule " + rule.getCode() + " has no logic descriptor");
        }
        RuleLogicEvaluator evaluator = evaluators.get(logic.getType());
        if (evaluator == null) {
            throw new IllegalArgumentException("No evaluator for logic type " + logic.getType());
        }
        return evaluator.evaluate(rule, facts);
    }
}
