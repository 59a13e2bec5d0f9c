package com.loanrecon.pipeline;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.CalculationTraceRepository;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentClassificationRepository;
import com.loanrecon.domain.DocumentFingerprint;
import com.loanrecon.domain.DocumentFingerprintRepository;
import com.loanrecon.domain.InstrumentGroupRepository;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.LoanDocumentRepository;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ManualAttributeValueRepository;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciledAttributeRepository;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.ingestion.intake.DocumentIntakeProcessor;
import com.loanrecon.ingestion.intake.IntakeResult;
import com.loanrecon.provenance.ProvenanceService;
import com.loanrecon.reconciliation.AttributeReconciler;
import com.loanrecon.versioning.InstrumentGroupingService;
import com.loanrecon.versioning.VersionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one reconciliation for a loan: intake → grouping → version resolution → attribute reconciliation →
 * provenance. Each run starts from scratch with a fresh {@link RunContext}; outputs replace the loan's previous
 * ones only after every stage finished. Stage-level degradation makes the run PARTIAL; an unexpected exception
 * makes it FAILED and leaves the previous outputs in place.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationPipeline {

    private final LoanRepository loanRepository;
    private final LoanDocumentRepository loanDocumentRepository;
    private final DocumentFingerprintRepository documentFingerprintRepository;
    private final DocumentClassificationRepository documentClassificationRepository;
    private final InstrumentGroupRepository instrumentGroupRepository;
    private final ReconciledAttributeRepository reconciledAttributeRepository;
    private final CalculationTraceRepository calculationTraceRepository;
    private final ManualAttributeValueRepository manualAttributeValueRepository;
    private final ReconciliationRunRepository reconciliationRunRepository;
    private final DocumentIntakeProcessor documentIntakeProcessor;
    private final InstrumentGroupingService instrumentGroupingService;
    private final VersionResolver versionResolver;
    private final AttributeReconciler attributeReconciler;
    private final ProvenanceService provenanceService;

    public ReconciliationRun run(String loanId, String executionId, ReconciliationRun.Trigger trigger, int retryCount) {
        if (!loanRepository.existsById(loanId)) {
            throw new LoanNotFoundException(loanId);
        }
        List<LoanDocument> documents = loanDocumentRepository.findByLoanIdOrderByIdAsc(loanId);
        RunContext ctx = new RunContext(loanId, executionId, documents);

        ReconciliationRun run = new ReconciliationRun();
        run.setExecutionId(ctx.getExecutionId());
        run.setLoanId(loanId);
        run.setTrigger(trigger);
        run.setRetryCount(retryCount);
        run.setStatus(ReconciliationRun.RunStatus.RUNNING);
        run.setDocumentCount(documents.size());
        run.setStartedAt(ctx.getStartedAt());
        reconciliationRunRepository.save(run);
        log.info("Reconciliation {} started for loan {} ({} documents, trigger {})",
                ctx.getExecutionId(), loanId, documents.size(), trigger);

        try {
            execute(ctx);
            persist(ctx);
            summarize(run, ctx);
        } catch (RuntimeException e) {
            log.error("Reconciliation {} for loan {} failed at stage {}", ctx.getExecutionId(), loanId, ctx.getStage(), e);
            run.setStatus(ReconciliationRun.RunStatus.FAILED);
            run.setErrorMessage(e.getClass().getSimpleName() + ": " + e.getMessage());
            run.setIssues(new ArrayList<>(ctx.issuesSnapshot()));
        }
        run.setCompletedAt(Instant.now());
        reconciliationRunRepository.save(run);
        log.info("Reconciliation {} for loan {} finished {} with {} issues",
                ctx.getExecutionId(), loanId, run.getStatus(), run.getIssues().size());
        return run;
    }

    void execute(RunContext ctx) {
        Map<String, DocumentClassification> previous = documentClassificationRepository.findByLoanId(ctx.getLoanId())
                .stream()
                .collect(Collectors.toMap(DocumentClassification::getDocumentId, Function.identity(), (a, b) -> a));
        IntakeResult intake = documentIntakeProcessor.process(ctx, previous);
        ctx.recordIntake(intake.fingerprints(), intake.classifications());

        ctx.recordGroups(instrumentGroupingService.group(ctx));
        ctx.recordResolvedGroups(versionResolver.resolveAll(ctx, ctx.getGroups()));

        ctx.recordAttributes(attributeReconciler.reconcile(ctx,
                manualAttributeValueRepository.findByLoanId(ctx.getLoanId())));
        ctx.recordTraces(provenanceService.buildAll(ctx));
    }

    private void persist(RunContext ctx) {
        String loanId = ctx.getLoanId();
        documentFingerprintRepository.deleteByLoanId(loanId);
        documentFingerprintRepository.saveAll(ctx.getFingerprints().values());
        documentClassificationRepository.deleteByLoanId(loanId);
        documentClassificationRepository.saveAll(ctx.getClassifications().values());
        instrumentGroupRepository.deleteByLoanId(loanId);
        instrumentGroupRepository.saveAll(ctx.getGroups());
        reconciledAttributeRepository.deleteByLoanId(loanId);
        reconciledAttributeRepository.saveAll(ctx.getAttributes().values());
        calculationTraceRepository.deleteByLoanId(loanId);
        calculationTraceRepository.saveAll(ctx.getTraces().values());
    }

    private static void summarize(ReconciliationRun run, RunContext ctx) {
        List<RunIssue> issues = ctx.issuesSnapshot();
        run.setIssues(new ArrayList<>(issues));
        run.setDuplicateCount((int) ctx.getFingerprints().values().stream()
                .filter(f -> f.getStatus() == DocumentFingerprint.FingerprintStatus.EXACT_DUPLICATE).count());
        run.setNeedsReviewCount((int) ctx.getClassifications().values().stream()
                .filter(c -> !c.isClassified()).count());
        run.setGroupCount(ctx.getGroups().size());
        run.setAttributeCount(ctx.getAttributes().size());
        run.setUnsourcedCount((int) ctx.getAttributes().values().stream().filter(ReconciledAttribute::isUnsourced).count());
        run.setVerificationErrorCount((int) ctx.getTraces().values().stream()
                .map(CalculationTrace::getStatus)
                .filter(s -> s == VerificationStatus.VERIFICATION_ERROR)
                .count());
        run.setStatus(issues.isEmpty() ? ReconciliationRun.RunStatus.COMPLETE : ReconciliationRun.RunStatus.PARTIAL);
    }
}
