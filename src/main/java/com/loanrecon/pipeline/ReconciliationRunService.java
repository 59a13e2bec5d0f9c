package com.loanrecon.pipeline;

import com.loanrecon.config.AsyncConfig;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ReconciliationCompletedEvent;
import com.loanrecon.domain.ReconciliationRequestedEvent;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts reconciliation requests and runs them on reconciliation-executor. At most one run per loan is in flight;
 * a finished (COMPLETE or PARTIAL) run publishes {@link ReconciliationCompletedEvent}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationRunService {

    private final LoanRepository loanRepository;
    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ReconciliationPipeline reconciliationPipeline;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Set<String> inFlightLoans = ConcurrentHashMap.newKeySet();

    /**
     * @return execution id of the accepted run
     * @throws LoanNotFoundException when the loan does not exist
     */
    public String requestReconciliation(String loanId, ReconciliationRun.Trigger trigger) {
        if (!loanRepository.existsById(loanId)) {
            throw new LoanNotFoundException(loanId);
        }
        String executionId = UUID.randomUUID().toString();
        applicationEventPublisher.publishEvent(new ReconciliationRequestedEvent(loanId, executionId, trigger));
        return executionId;
    }

    @EventListener
    @Async(AsyncConfig.RECONCILIATION_EXECUTOR)
    public void onReconciliationRequested(ReconciliationRequestedEvent event) {
        runNow(event.loanId(), event.executionId(), event.trigger());
    }

    /**
     * Runs on the calling thread. Skips (returns null) when a run for the loan is already in flight.
     */
    public ReconciliationRun runNow(String loanId, String executionId, ReconciliationRun.Trigger trigger) {
        if (!inFlightLoans.add(loanId)) {
            log.info("Reconciliation for loan {} already in flight; request {} skipped", loanId, executionId);
            return null;
        }
        try {
            int retryCount = 0;
            if (trigger == ReconciliationRun.Trigger.SCHEDULED_RETRY) {
                retryCount = reconciliationRunRepository.findFirstByLoanIdOrderByStartedAtDesc(loanId)
                        .map(r -> r.getRetryCount() + 1)
                        .orElse(1);
            }
            ReconciliationRun run = reconciliationPipeline.run(loanId, executionId, trigger, retryCount);
            if (run.getStatus() != ReconciliationRun.RunStatus.FAILED) {
                applicationEventPublisher.publishEvent(
                        new ReconciliationCompletedEvent(loanId, run.getExecutionId(), run.getStatus()));
            }
            return run;
        } catch (LoanNotFoundException e) {
            log.warn("Reconciliation {} skipped: {}", executionId, e.getMessage());
            return null;
        } finally {
            inFlightLoans.remove(loanId);
        }
    }
}
