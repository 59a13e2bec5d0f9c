package com.loanrecon.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Explicit, versioned state of one reconciliation run: loan id, execution id and stage outputs keyed by id.
 * Passed through every stage instead of global state. Stages must be recorded in pipeline order.
 */
@Getter
public final class RunContext {

    private final String loanId;
    private final String executionId;
    private final Instant startedAt;
    /** Document arena, sorted by id. */
    private final Map<String, LoanDocument> documents;
    private final List<RunIssue> issues = Collections.synchronizedList(new ArrayList<>());

    private Stage stage = Stage.STARTED;
    private Map<String, DocumentFingerprint> fingerprints = Map.of();
    private Map<String, DocumentClassification> classifications = Map.of();
    private List<InstrumentGroup> groups = List.of();
    private Map<String, ReconciledAttribute> attributes = Map.of();
    private Map<String, CalculationTrace> traces = Map.of();

    public RunContext(String loanId, String executionId, List<LoanDocument> documents) {
        this.loanId = Objects.requireNonNull(loanId, "loanId");
        this.executionId = executionId != null ? executionId : UUID.randomUUID().toString();
        this.startedAt = Instant.now();
        TreeMap<String, LoanDocument> byId = new TreeMap<>();
        if (documents != null) {
            for (LoanDocument d : documents) {
                byId.put(d.getId(), d);
            }
        }
        this.documents = Collections.unmodifiableMap(byId);
    }

    public void addIssue(RunIssue issue) {
        issues.add(issue);
    }

    public List<RunIssue> issuesSnapshot() {
        synchronized (issues) {
            return List.copyOf(issues);
        }
    }

    public void recordIntake(Map<String, DocumentFingerprint> fingerprints,
                             Map<String, DocumentClassification> classifications) {
        advance(Stage.STARTED, Stage.INTAKE_COMPLETE);
        this.fingerprints = Collections.unmodifiableMap(new TreeMap<>(fingerprints));
        this.classifications = Collections.unmodifiableMap(new TreeMap<>(classifications));
    }

    public void recordGroups(List<InstrumentGroup> groups) {
        advance(Stage.INTAKE_COMPLETE, Stage.GROUPED);
        this.groups = List.copyOf(groups);
    }

    public void recordResolvedGroups(List<InstrumentGroup> groups) {
        advance(Stage.GROUPED, Stage.VERSIONS_RESOLVED);
        this.groups = List.copyOf(groups);
    }

    public void recordAttributes(Map<String, ReconciledAttribute> attributes) {
        advance(Stage.VERSIONS_RESOLVED, Stage.ATTRIBUTES_RECONCILED);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public void recordTraces(Map<String, CalculationTrace> traces) {
        advance(Stage.ATTRIBUTES_RECONCILED, Stage.PROVENANCE_VERIFIED);
        this.traces = Collections.unmodifiableMap(new LinkedHashMap<>(traces));
    }

    /**
     * Documents eligible for grouping: fingerprinted (not duplicate, not unfingerprintable) and classified.
     */
    public List<LoanDocument> groupingCandidates() {
        List<LoanDocument> out = new ArrayList<>();
        for (LoanDocument d : documents.values()) {
            DocumentFingerprint fp = fingerprints.get(d.getId());
            DocumentClassification c = classifications.get(d.getId());
            if (fp != null && fp.isUsableForGrouping() && c != null && c.isClassified()) {
                out.add(d);
            }
        }
        return out;
    }

    public LoanDocument document(String documentId) {
        return documentId == null ? null : documents.get(documentId);
    }

    private void advance(Stage expected, Stage next) {
        if (stage != expected) {
            throw new IllegalStateException("Run " + executionId + " for loan " + loanId
                    + " cannot move to " + next + " from " + stage);
        }
        stage = next;
    }

    public enum Stage {
        STARTED,
        INTAKE_COMPLETE,
        GROUPED,
        VERSIONS_RESOLVED,
        ATTRIBUTES_RECONCILED,
        PROVENANCE_VERIFIED
    }
}
