package com.loanrecon.compliance;

import com.loanrecon.config.CaffeineConfig;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Active compliance rules, read from MongoDB and shared read-only through the Caffeine rule catalog cache.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleCatalog {

    private final ComplianceRuleRepository complianceRuleRepository;

    @Cacheable(cacheNames = CaffeineConfig.RULE_CATALOG_CACHE, key = "'active'")
    public List<ComplianceRule> activeRules() {
        List<ComplianceRule> rules = List.copyOf(complianceRuleRepository.findByActiveTrueOrderByCodeAsc());
        log.info("Loaded {} active compliance rules", rules.size());
        return rules;
    }

    @CacheEvict(cacheNames = CaffeineConfig.RULE_CATALOG_CACHE, allEntries = true)
    public void invalidate() {
        log.debug("Rule catalog cache invalidated");
    }
}
