package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.RuleLogic;

/**
 * Evaluates one kind of rule logic descriptor. Implementations are pure: no I/O, no shared state.
 * Missing inputs are signalled with {@link com.loanrecon.compliance.MissingAttributeException}.
 */
public interface RuleLogicEvaluator {

    RuleLogic.LogicType type();

    RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts);
}
