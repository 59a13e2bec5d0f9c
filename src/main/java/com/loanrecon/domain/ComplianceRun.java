package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one compliance execution for a loan (counts per status and overall status).
 */
@Document(collection = "compliance_runs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ComplianceRun {

    @Id
    @EqualsAndHashCode.Include
    private String executionId;
    @Indexed
    private String loanId;
    /** Reconciliation execution whose attributes were evaluated. */
    private String reconciliationExecutionId;
    private ComplianceStatus overallStatus;
    private Map<ComplianceStatus, Integer> counts = new EnumMap<>(ComplianceStatus.class);
    private int totalRules;
    private Instant startedAt;
    private Instant completedAt;
}
