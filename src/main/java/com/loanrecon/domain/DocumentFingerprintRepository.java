package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for document_fingerprints. Replaced per loan on every reconciliation run.
 */
public interface DocumentFingerprintRepository extends MongoRepository<DocumentFingerprint, String> {

    List<DocumentFingerprint> findByLoanId(String loanId);

    void deleteByLoanId(String loanId);
}
