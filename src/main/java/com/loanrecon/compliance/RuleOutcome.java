package com.loanrecon.compliance;

import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.EvidenceBundle;

/**
 * Pure result of evaluating one rule's logic.
 */
public record RuleOutcome(ComplianceStatus status,
                          String message,
                          String expectedValue,
                          String actualValue,
                          String variance,
                          EvidenceBundle evidence) {

    public RuleOutcome {
        evidence = evidence != null ? evidence : EvidenceBundle.empty();
    }

    public static RuleOutcome of(ComplianceStatus status, String message, String expected, String actual,
                                 EvidenceBundle evidence) {
        return new RuleOutcome(status, message, expected, actual, null, evidence);
    }

    public RuleOutcome withVariance(String variance) {
        return new RuleOutcome(status, message, expectedValue, actualValue, variance, evidence);
    }

    public RuleOutcome withStatus(ComplianceStatus newStatus, String newMessage) {
        return new RuleOutcome(newStatus, newMessage, expectedValue, actualValue, variance, evidence);
    }
}
