package com.loanrecon.pipeline;

import com.loanrecon.compliance.ComplianceEngine;
import com.loanrecon.compliance.ComplianceEvaluation;
import com.loanrecon.config.AsyncConfig;
import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.CalculationTraceRepository;
import com.loanrecon.domain.ComplianceRequestedEvent;
import com.loanrecon.domain.ComplianceResultRepository;
import com.loanrecon.domain.ComplianceRun;
import com.loanrecon.domain.ComplianceRunRepository;
import com.loanrecon.domain.Loan;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciledAttributeRepository;
import com.loanrecon.domain.ReconciliationCompletedEvent;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates compliance against the loan's persisted reconciled record and appends the results.
 * Triggered after each finished reconciliation and on explicit request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplianceRunService {

    private final LoanRepository loanRepository;
    private final ReconciledAttributeRepository reconciledAttributeRepository;
    private final CalculationTraceRepository calculationTraceRepository;
    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ComplianceResultRepository complianceResultRepository;
    private final ComplianceRunRepository complianceRunRepository;
    private final ComplianceEngine complianceEngine;

    @EventListener
    public void onReconciliationCompleted(ReconciliationCompletedEvent event) {
        try {
            evaluate(event.loanId());
        } catch (RuntimeException e) {
            log.error("Compliance after reconciliation {} failed for loan {}", event.executionId(), event.loanId(), e);
        }
    }

    @EventListener
    @Async(AsyncConfig.RECONCILIATION_EXECUTOR)
    public void onComplianceRequested(ComplianceRequestedEvent event) {
        try {
            evaluate(event.loanId());
        } catch (RuntimeException e) {
            log.error("Requested compliance run failed for loan {}", event.loanId(), e);
        }
    }

    public ComplianceRun evaluate(String loanId) {
        Loan loan = loanRepository.findById(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
        Map<String, ReconciledAttribute> attributes = new LinkedHashMap<>();
        reconciledAttributeRepository.findByLoanIdOrderByNameAsc(loanId).forEach(a -> attributes.put(a.getName(), a));
        Map<String, CalculationTrace> traces = new LinkedHashMap<>();
        calculationTraceRepository.findByLoanId(loanId).forEach(t -> traces.put(t.getAttributeName(), t));
        String reconciliationExecutionId = attributes.values().stream()
                .map(ReconciledAttribute::getExecutionId)
                .findFirst()
                .orElseGet(() -> reconciliationRunRepository.findFirstByLoanIdOrderByStartedAtDesc(loanId)
                        .map(ReconciliationRun::getExecutionId)
                        .orElse(null));

        ComplianceEvaluation evaluation = complianceEngine.evaluate(loan, attributes, traces, reconciliationExecutionId);
        complianceResultRepository.insert(evaluation.results());
        complianceRunRepository.insert(evaluation.run());
        return evaluation.run();
    }
}
