package com.loanrecon.compliance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.compliance.config.ComplianceProperties;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Seeds compliance_rules from the bundled JSON catalog when the collection is empty.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleCatalogSeeder {

    private final ComplianceRuleRepository complianceRuleRepository;
    private final ComplianceProperties complianceProperties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RuleCatalog ruleCatalog;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!complianceProperties.isSeedOnStartup()) {
            return;
        }
        if (complianceRuleRepository.count() > 0) {
            log.debug("compliance_rules already populated; skipping seed");
            return;
        }
        List<ComplianceRule> rules = readRules(complianceProperties.getSeedLocation());
        complianceRuleRepository.saveAll(rules);
        ruleCatalog.invalidate();
        log.info("Seeded {} compliance rules from {}", rules.size(), complianceProperties.getSeedLocation());
    }

    List<ComplianceRule> readRules(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<ComplianceRule>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read compliance rules from " + location, e);
        }
    }
}
