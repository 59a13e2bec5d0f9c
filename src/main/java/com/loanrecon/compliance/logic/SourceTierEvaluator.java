package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.RuleLogic;
import com.loanrecon.domain.SourceTier;
import org.springframework.stereotype.Component;

/**
 * The attribute should come from the primary source; a fallback or manual source is a WARNING.
 */
@Component
public class SourceTierEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.SOURCE_TIER;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        String name = rule.getLogic().getAttribute();
        ReconciledAttribute a = facts.attribute(name);
        boolean primary = a.getSourceTier() == SourceTier.PRIMARY;
        String actual = a.getSourceTier() + (a.getSourceInstrumentType() != null ? " (" + a.getSourceInstrumentType() + ")" : "");
        return RuleOutcome.of(primary ? ComplianceStatus.PASS : ComplianceStatus.WARNING,
                name + " sourced from " + actual,
                SourceTier.PRIMARY.name(), actual, new EvidenceBuilder(facts).cite(name).build());
    }
}
