package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One reconciliation execution for a loan. PARTIAL means results exist but some documents/attributes
 * degraded (see {@link #issues}); FAILED means the pipeline itself aborted.
 */
@Document(collection = "reconciliation_runs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReconciliationRun {

    @Id
    @EqualsAndHashCode.Include
    private String executionId;
    @Indexed
    private String loanId;
    private RunStatus status;
    private Trigger trigger;
    /** Number of scheduled retries that preceded this run for the same loan. */
    private int retryCount;
    private int documentCount;
    private int duplicateCount;
    private int needsReviewCount;
    private int groupCount;
    private int attributeCount;
    private int unsourcedCount;
    private int verificationErrorCount;
    private List<RunIssue> issues = new ArrayList<>();
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public boolean hasOracleFailures() {
        return issues != null && issues.stream().anyMatch(i -> i.getKind() == RunIssue.Kind.ORACLE_FAILURE);
    }

    public enum RunStatus {
        RUNNING,
        COMPLETE,
        PARTIAL,
        FAILED
    }

    public enum Trigger {
        API,
        SCHEDULED_RETRY,
        DIRECT
    }
}
