package com.loanrecon.pipeline;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.CalculationTraceRepository;
import com.loanrecon.domain.ComplianceRequestedEvent;
import com.loanrecon.domain.ComplianceResult;
import com.loanrecon.domain.ComplianceResultRepository;
import com.loanrecon.domain.ComplianceRun;
import com.loanrecon.domain.ComplianceRunRepository;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.LoanDocumentRepository;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ManualAttributeValue;
import com.loanrecon.domain.ManualAttributeValueRepository;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciledAttributeRepository;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of a loan's reconciled record plus the re-run and manual-entry commands.
 * Every method rejects unknown loans with {@link LoanNotFoundException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LoanRecordService {

    private final LoanRepository loanRepository;
    private final LoanDocumentRepository loanDocumentRepository;
    private final ReconciledAttributeRepository reconciledAttributeRepository;
    private final CalculationTraceRepository calculationTraceRepository;
    private final ComplianceRunRepository complianceRunRepository;
    private final ComplianceResultRepository complianceResultRepository;
    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ManualAttributeValueRepository manualAttributeValueRepository;
    private final ReconciliationRunService reconciliationRunService;
    private final ApplicationEventPublisher applicationEventPublisher;

    public List<ReconciledAttribute> getReconciledAttributes(String loanId) {
        requireLoan(loanId);
        return reconciledAttributeRepository.findByLoanIdOrderByNameAsc(loanId);
    }

    public Optional<CalculationTrace> getCalculationTrace(String loanId, String attributeName) {
        requireLoan(loanId);
        return calculationTraceRepository.findByLoanIdAndAttributeName(loanId, attributeName);
    }

    /**
     * Results of the most recent compliance execution; empty when compliance never ran for the loan.
     */
    public List<ComplianceResult> getComplianceResults(String loanId) {
        return getLatestComplianceRun(loanId)
                .map(run -> complianceResultRepository.findByLoanIdAndExecutionIdOrderByRuleCodeAsc(loanId, run.getExecutionId()))
                .orElse(List.of());
    }

    public Optional<ComplianceRun> getLatestComplianceRun(String loanId) {
        requireLoan(loanId);
        return complianceRunRepository.findFirstByLoanIdOrderByStartedAtDesc(loanId);
    }

    public Optional<ReconciliationRun> getLatestReconciliationRun(String loanId) {
        requireLoan(loanId);
        return reconciliationRunRepository.findFirstByLoanIdOrderByStartedAtDesc(loanId);
    }

    /**
     * Starts a fresh reconciliation asynchronously. Compliance follows automatically once it finishes.
     *
     * @return execution id of the new run
     */
    public String reRunReconciliation(String loanId) {
        String executionId = reconciliationRunService.requestReconciliation(loanId, ReconciliationRun.Trigger.API);
        log.info("Reconciliation {} requested for loan {}", executionId, loanId);
        return executionId;
    }

    public void reRunCompliance(String loanId) {
        requireLoan(loanId);
        applicationEventPublisher.publishEvent(new ComplianceRequestedEvent(loanId));
        log.info("Compliance re-run requested for loan {}", loanId);
    }

    /**
     * Stores (or replaces) the reviewer-entered value for one attribute. The cited document must belong to the
     * loan and the page, when given, must exist in it. Takes effect on the next reconciliation.
     *
     * @throws IllegalArgumentException when the citation does not resolve
     */
    public ManualAttributeValue addManualAttribute(String loanId, String attributeName, FieldValue value,
                                                   String documentId, Integer page, String enteredBy, String note) {
        requireLoan(loanId);
        LoanDocument document = loanDocumentRepository.findById(documentId)
                .filter(d -> loanId.equals(d.getLoanId()))
                .orElseThrow(() -> new IllegalArgumentException("Document " + documentId + " does not belong to loan " + loanId));
        if (page != null && !document.hasPage(page)) {
            throw new IllegalArgumentException("Document " + documentId + " has no page " + page);
        }
        ManualAttributeValue entry = manualAttributeValueRepository.findByLoanIdAndAttributeName(loanId, attributeName)
                .orElseGet(ManualAttributeValue::new);
        entry.setId(loanId + ":" + attributeName);
        entry.setLoanId(loanId);
        entry.setAttributeName(attributeName);
        entry.setValue(value);
        entry.setDocumentId(documentId);
        entry.setPage(page);
        entry.setEnteredBy(enteredBy);
        entry.setNote(note);
        entry.setEnteredAt(Instant.now());
        ManualAttributeValue saved = manualAttributeValueRepository.save(entry);
        log.info("Manual value for {} on loan {} entered by {} citing {} p.{}", attributeName, loanId, enteredBy, documentId, page);
        return saved;
    }

    private void requireLoan(String loanId) {
        if (!loanRepository.existsById(loanId)) {
            throw new LoanNotFoundException(loanId);
        }
    }
}
