package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for reconciliation_runs.
 */
public interface ReconciliationRunRepository extends MongoRepository<ReconciliationRun, String> {

    Optional<ReconciliationRun> findFirstByLoanIdOrderByStartedAtDesc(String loanId);

    List<ReconciliationRun> findByStatus(ReconciliationRun.RunStatus status);
}
