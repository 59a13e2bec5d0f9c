package com.loanrecon.pipeline;

import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import com.loanrecon.reconciliation.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-runs loans whose latest reconciliation is PARTIAL because the oracle failed on some documents,
 * up to {@code loanrecon.reconciliation.max-partial-retries} times.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PartialRunRetryJob {

    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ReconciliationRunService reconciliationRunService;
    private final ReconciliationProperties reconciliationProperties;

    @Scheduled(fixedDelayString = "${loanrecon.reconciliation.retry-interval-ms:900000}",
            initialDelayString = "${loanrecon.reconciliation.retry-interval-ms:900000}")
    public void retryPartialRuns() {
        List<ReconciliationRun> partial = reconciliationRunRepository.findByStatus(ReconciliationRun.RunStatus.PARTIAL);
        Set<String> seen = new HashSet<>();
        int requested = 0;
        for (ReconciliationRun run : partial) {
            if (!isRetryable(run) || !seen.add(run.getLoanId())) {
                continue;
            }
            reconciliationRunService.requestReconciliation(run.getLoanId(), ReconciliationRun.Trigger.SCHEDULED_RETRY);
            requested++;
        }
        if (requested > 0) {
            log.info("Requested {} scheduled re-run(s) of PARTIAL reconciliations", requested);
        }
    }

    private boolean isRetryable(ReconciliationRun run) {
        if (!run.hasOracleFailures() || run.getRetryCount() >= reconciliationProperties.getMaxPartialRetries()) {
            return false;
        }
        return reconciliationRunRepository.findFirstByLoanIdOrderByStartedAtDesc(run.getLoanId())
                .map(latest -> latest.getExecutionId().equals(run.getExecutionId()))
                .orElse(false);
    }
}
