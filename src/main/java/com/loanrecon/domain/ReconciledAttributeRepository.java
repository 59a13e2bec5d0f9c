package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for reconciled_attributes. Replaced per loan on every reconciliation run.
 */
public interface ReconciledAttributeRepository extends MongoRepository<ReconciledAttribute, String> {

    List<ReconciledAttribute> findByLoanIdOrderByNameAsc(String loanId);

    void deleteByLoanId(String loanId);
}
