package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for manual_attribute_values.
 */
public interface ManualAttributeValueRepository extends MongoRepository<ManualAttributeValue, String> {

    List<ManualAttributeValue> findByLoanId(String loanId);

    Optional<ManualAttributeValue> findByLoanIdAndAttributeName(String loanId, String attributeName);
}
