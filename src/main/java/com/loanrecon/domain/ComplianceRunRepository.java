package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for compliance_runs.
 */
public interface ComplianceRunRepository extends MongoRepository<ComplianceRun, String> {

    Optional<ComplianceRun> findFirstByLoanIdOrderByStartedAtDesc(String loanId);
}
