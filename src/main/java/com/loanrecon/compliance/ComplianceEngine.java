package com.loanrecon.compliance;

import com.loanrecon.compliance.config.ComplianceProperties;
import com.loanrecon.compliance.logic.RuleLogicDispatcher;
import com.loanrecon.config.AsyncConfig;
import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.ComplianceResult;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceRun;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.EvidenceBundle;
import com.loanrecon.domain.Loan;
import com.loanrecon.domain.ReconciledAttribute;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluates the active rule catalog against one loan's reconciled record. Rules run in parallel on
 * compliance-executor; loans are evaluated one at a time. Every rule yields exactly one result.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComplianceEngine {

    private final RuleCatalog ruleCatalog;
    private final RuleLogicDispatcher ruleLogicDispatcher;
    private final ComplianceProperties complianceProperties;
    @Qualifier(AsyncConfig.COMPLIANCE_EXECUTOR)
    private final Executor complianceExecutor;

    private final ReentrantLock loanLock = new ReentrantLock();

    public ComplianceEvaluation evaluate(Loan loan, Map<String, ReconciledAttribute> attributes,
                                         Map<String, CalculationTrace> traces, String reconciliationExecutionId) {
        loanLock.lock();
        try {
            return evaluateLocked(loan, attributes, traces, reconciliationExecutionId);
        } finally {
            loanLock.unlock();
        }
    }

    private ComplianceEvaluation evaluateLocked(Loan loan, Map<String, ReconciledAttribute> attributes,
                                                Map<String, CalculationTrace> traces, String reconciliationExecutionId) {
        String executionId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        LoanFacts facts = new LoanFacts(loan, attributes, traces, LocalDate.now());
        List<ComplianceRule> rules = ruleCatalog.activeRules();

        List<CompletableFuture<ComplianceResult>> futures = new ArrayList<>(rules.size());
        for (ComplianceRule rule : rules) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateRule(rule, facts, executionId), complianceExecutor));
        }
        List<ComplianceResult> results = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            results.add(await(futures.get(i), rules.get(i), loan.getId(), executionId));
        }

        ComplianceRun run = new ComplianceRun();
        run.setExecutionId(executionId);
        run.setLoanId(loan.getId());
        run.setReconciliationExecutionId(reconciliationExecutionId);
        run.setTotalRules(results.size());
        Map<ComplianceStatus, Integer> counts = new EnumMap<>(ComplianceStatus.class);
        results.forEach(r -> counts.merge(r.getStatus(), 1, Integer::sum));
        run.setCounts(counts);
        run.setOverallStatus(overallStatus(counts.keySet()));
        run.setStartedAt(startedAt);
        run.setCompletedAt(Instant.now());
        log.info("Compliance run {} for loan {}: {} rules, overall {} {}", executionId, loan.getId(),
                results.size(), run.getOverallStatus(), counts);
        return new ComplianceEvaluation(run, results);
    }

    private ComplianceResult await(CompletableFuture<ComplianceResult> future, ComplianceRule rule,
                                   String loanId, String executionId) {
        try {
            return future.get(complianceProperties.getRuleTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return error(rule, loanId, executionId, "Rule " + rule.getCode() + " timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(rule, loanId, executionId, "Rule " + rule.getCode() + " interrupted");
        } catch (ExecutionException e) {
            return error(rule, loanId, executionId, "Rule " + rule.getCode() + " failed: " + e.getCause().getMessage());
        }
    }

    /**
     * Applicability → logic → evidence gate. Never throws.
     */
    ComplianceResult evaluateRule(ComplianceRule rule, LoanFacts facts, String executionId) {
        Loan loan = facts.loan();
        ComplianceResult result = newResult(rule, loan.getId(), executionId);
        String notApplicable = notApplicableReason(rule, facts);
        if (notApplicable != null) {
            result.setStatus(ComplianceStatus.NA);
            result.setMessage(notApplicable);
            return result;
        }
        try {
            RuleOutcome outcome = ruleLogicDispatcher.evaluate(rule, facts);
            if (outcome.status() == ComplianceStatus.PASS && !outcome.evidence().citesDocuments()) {
                outcome = outcome.withStatus(ComplianceStatus.PENDING_REVIEW,
                        outcome.message() + " (no source document cited; needs review)");
            }
            result.setStatus(outcome.status());
            result.setMessage(outcome.message());
            result.setExpectedValue(outcome.expectedValue());
            result.setActualValue(outcome.actualValue());
            result.setVariance(outcome.variance());
            result.setEvidence(outcome.evidence());
        } catch (MissingAttributeException e) {
            result.setStatus(ComplianceStatus.ERROR);
            result.setMessage("Rule " + rule.getCode() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Rule {} errored for loan {}: {}", rule.getCode(), loan.getId(), e.getMessage());
            result.setStatus(ComplianceStatus.ERROR);
            result.setMessage("Rule " + rule.getCode() + " failed: " + e.getMessage());
        }
        if (result.getStatus() == ComplianceStatus.PENDING_REVIEW) {
            result.setRequiresManualReview(true);
        }
        return result;
    }

    static String notApplicableReason(ComplianceRule rule, LoanFacts facts) {
        Loan loan = facts.loan();
        if (!rule.appliesToLoanType(loan.getLoanType())) {
            return "Not applicable to loan type " + loan.getLoanType();
        }
        if (!rule.appliesToState(loan.getPropertyState())) {
            return "Not applicable in state " + loan.getPropertyState();
        }
        LocalDate on = facts.applicabilityDate();
        if (!rule.isEffectiveOn(on)) {
            return "Not in effect on " + on;
        }
        return null;
    }

    /** FAIL > ERROR > WARNING/PENDING_REVIEW > PASS; a run of only NA rules is PASS. */
    public static ComplianceStatus overallStatus(Collection<ComplianceStatus> statuses) {
        if (statuses.contains(ComplianceStatus.FAIL)) {
            return ComplianceStatus.FAIL;
        }
        if (statuses.contains(ComplianceStatus.ERROR)) {
            return ComplianceStatus.ERROR;
        }
        if (statuses.contains(ComplianceStatus.WARNING) || statuses.contains(ComplianceStatus.PENDING_REVIEW)) {
            return ComplianceStatus.WARNING;
        }
        return ComplianceStatus.PASS;
    }

    private static ComplianceResult newResult(ComplianceRule rule, String loanId, String executionId) {
        ComplianceResult r = new ComplianceResult();
        r.setId(executionId + ":" + rule.getCode());
        r.setLoanId(loanId);
        r.setExecutionId(executionId);
        r.setRuleCode(rule.getCode());
        r.setRuleName(rule.getName());
        r.setCategory(rule.getCategory());
        r.setSeverity(rule.getSeverity());
        r.setRequiresManualReview(rule.isRequiresManualReview());
        r.setRemediationGuidance(rule.getRemediationGuidance());
        r.setEvidence(EvidenceBundle.empty());
        r.setEvaluatedAt(Instant.now());
        return r;
    }

    private static ComplianceResult error(ComplianceRule rule, String loanId, String executionId, String message) {
        ComplianceResult r = newResult(rule, loanId, executionId);
        r.setStatus(ComplianceStatus.ERROR);
        r.setMessage(message);
        return r;
    }
}
