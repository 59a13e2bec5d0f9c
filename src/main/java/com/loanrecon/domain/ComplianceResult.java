package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Outcome of one rule for one loan in one execution. Append-only: inserted once, superseded by a newer execution.
 */
@Document(collection = "compliance_results")
@CompoundIndex(name = "loan_execution_rule", def = "{'loanId': 1, 'executionId': 1, 'ruleCode': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ComplianceResult {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String executionId;
    private String ruleCode;
    private String ruleName;
    private RuleCategory category;
    private Severity severity;
    private ComplianceStatus status;
    private String message;
    private String expectedValue;
    private String actualValue;
    private String variance;
    private EvidenceBundle evidence = EvidenceBundle.empty();
    private boolean requiresManualReview;
    private String remediationGuidance;
    private Instant evaluatedAt;
}
