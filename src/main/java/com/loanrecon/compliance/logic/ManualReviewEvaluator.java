package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

/**
 * Rules that cannot be decided mechanically. Cites the named attributes if present.
 */
@Component
public class ManualReviewEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.MANUAL;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        EvidenceBuilder evidence = new EvidenceBuilder(facts);
        if (logic.getAttribute() != null) {
            evidence.cite(logic.getAttribute());
        }
        if (logic.getOtherAttribute() != null) {
            evidence.cite(logic.getOtherAttribute());
        }
        return RuleOutcome.of(ComplianceStatus.PENDING_REVIEW, "Requires reviewer judgment", null, null, evidence.build());
    }
}
