package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for instrument_groups (with embedded version records).
 */
public interface InstrumentGroupRepository extends MongoRepository<InstrumentGroup, String> {

    List<InstrumentGroup> findByLoanIdOrderByGroupKeyAsc(String loanId);

    void deleteByLoanId(String loanId);
}
