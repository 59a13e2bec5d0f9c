package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for documents. Ordered by id so every stage sees the same iteration order.
 */
public interface LoanDocumentRepository extends MongoRepository<LoanDocument, String> {

    List<LoanDocument> findByLoanIdOrderByIdAsc(String loanId);
}
