package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

/**
 * A prohibited loan feature (balloon payment, negative amortization, ...) must be absent.
 */
@Component
public class ProhibitedFlagEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.PROHIBITED_FLAG;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        String name = rule.getLogic().getAttribute();
        boolean present = facts.bool(name);
        return RuleOutcome.of(present ? ComplianceStatus.FAIL : ComplianceStatus.PASS,
                present ? "Prohibited feature " + name + " is present" : "Prohibited feature " + name + " is absent",
                "false", String.valueOf(present), new EvidenceBuilder(facts).cite(name).build());
    }
}
