package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for calculation_traces. Replaced per loan on every reconciliation run.
 */
public interface CalculationTraceRepository extends MongoRepository<CalculationTrace, String> {

    List<CalculationTrace> findByLoanId(String loanId);

    Optional<CalculationTrace> findByLoanIdAndAttributeName(String loanId, String attributeName);

    void deleteByLoanId(String loanId);
}
