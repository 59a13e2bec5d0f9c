package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for document_classifications. CLASSIFIED rows are reused across runs when the exact hash is unchanged.
 */
public interface DocumentClassificationRepository extends MongoRepository<DocumentClassification, String> {

    List<DocumentClassification> findByLoanId(String loanId);

    void deleteByLoanId(String loanId);
}
