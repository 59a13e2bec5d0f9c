package com.loanrecon.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for compliance_rules (reference data).
 */
public interface ComplianceRuleRepository extends MongoRepository<ComplianceRule, String> {

    List<ComplianceRule> findByActiveTrueOrderByCodeAsc();
}
