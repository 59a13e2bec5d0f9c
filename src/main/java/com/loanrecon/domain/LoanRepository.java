package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for loans (read-only for the engine).
 */
public interface LoanRepository extends MongoRepository<Loan, String> {
}
