package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for compliance_results. Writers only call insert; results are never updated.
 */
public interface ComplianceResultRepository extends MongoRepository<ComplianceResult, String> {

    List<ComplianceResult> findByLoanIdAndExecutionIdOrderByRuleCodeAsc(String loanId, String executionId);
}
