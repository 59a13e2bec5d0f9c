package com.loanrecon.compliance.logic;

import com.loanrecon.compliance.EvidenceBuilder;
import com.loanrecon.compliance.LoanFacts;
import com.loanrecon.compliance.RuleOutcome;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.RuleLogic;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Calendar days from attribute to otherAttribute OP threshold, e.g. application date to LE delivery ≤ 3.
 */
@Component
public class DaysBetweenEvaluator implements RuleLogicEvaluator {

    @Override
    public RuleLogic.LogicType type() {
        return RuleLogic.LogicType.DAYS_BETWEEN;
    }

    @Override
    public RuleOutcome evaluate(ComplianceRule rule, LoanFacts facts) {
        RuleLogic logic = rule.getLogic();
        LocalDate from = facts.date(logic.getAttribute());
        LocalDate to = facts.date(logic.getOtherAttribute());
        long days = ChronoUnit.DAYS.between(from, to);
        String label = "days from " + logic.getAttribute() + " to " + logic.getOtherAttribute();
        return Thresholds.judge(logic, BigDecimal.valueOf(days), label, new EvidenceBuilder(facts)
                .cite(logic.getAttribute())
                .cite(logic.getOtherAttribute())
                .value("days", days)
                .build());
    }
}
