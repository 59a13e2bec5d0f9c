package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Declarative logic descriptor of a compliance rule. Which fields are read depends on {@link #type}:
 * <ul>
 *   <li>THRESHOLD: attribute OP threshold; optional warningThreshold with the same operator.</li>
 *   <li>RATIO_THRESHOLD: attribute / otherAttribute × scale OP threshold.</li>
 *   <li>DAYS_BETWEEN: days from attribute (date) to otherAttribute (date) OP threshold.</li>
 *   <li>VALUE_MATCH: |attribute − otherAttribute| ≤ tolerance.</li>
 *   <li>PROHIBITED_FLAG: boolean attribute must be false.</li>
 *   <li>VERIFICATION_STATUS: calculation trace of attribute must MATCH.</li>
 *   <li>SOURCE_TIER: attribute must come from the primary tier.</li>
 *   <li>MANUAL: no automated logic; always pending review.</li>
 * </ul>
 * With useCalculatedValue the number is taken from the attribute's calculation trace terminal step.
 */
@NoArgsConstructor
@Getter
@Setter
public class RuleLogic {

    private LogicType type;
    private String attribute;
    private String otherAttribute;
    private boolean useCalculatedValue;
    private ComparisonOperator operator;
    private BigDecimal threshold;
    private BigDecimal warningThreshold;
    private BigDecimal scale;
    private BigDecimal tolerance;

    public enum LogicType {
        THRESHOLD,
        RATIO_THRESHOLD,
        DAYS_BETWEEN,
        VALUE_MATCH,
        PROHIBITED_FLAG,
        VERIFICATION_STATUS,
        SOURCE_TIER,
        MANUAL
    }
}
