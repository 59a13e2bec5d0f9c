package com.loanrecon.compliance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.loanrecon.compliance.config.ComplianceProperties;
import com.loanrecon.domain.ComplianceRule;
import com.loanrecon.domain.ComplianceRuleRepository;
import com.loanrecon.domain.RuleLogic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleCatalogSeederTest {

    @Mock
    private ComplianceRuleRepository complianceRuleRepository;
    @Mock
    private RuleCatalog ruleCatalog;

    private final ComplianceProperties properties = new ComplianceProperties();
    private RuleCatalogSeeder seeder;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        seeder = new RuleCatalogSeeder(complianceRuleRepository, properties, new DefaultResourceLoader(), objectMapper, ruleCatalog);
    }

    @Test
    void readRules_parsesBundledCatalog() {
        List<ComplianceRule> rules = seeder.readRules("classpath:compliance-rules.json");

        assertThat(rules).hasSize(11);
        assertThat(rules).extracting(ComplianceRule::getCode).doesNotHaveDuplicates()
                .contains("ATR-DTI-001", "TILA-APR-001", "RESPA-AFBA-001");
        assertThat(rules).allSatisfy(r -> {
            assertThat(r.getLogic()).isNotNull();
            assertThat(r.getLogic().getType()).isNotNull();
            assertThat(r.isActive()).isTrue();
        });
        ComplianceRule dti = rules.stream().filter(r -> r.getCode().equals("ATR-DTI-001")).findFirst().orElseThrow();
        assertThat(dti.getEffectiveDate()).isEqualTo(LocalDate.of(2014, 1, 10));
        assertThat(dti.getLogic().getType()).isEqualTo(RuleLogic.LogicType.RATIO_THRESHOLD);
        assertThat(dti.getLogic().getThreshold()).isEqualByComparingTo("43");
        ComplianceRule texas = rules.stream().filter(r -> r.getCode().equals("STATE-TX-001")).findFirst().orElseThrow();
        assertThat(texas.appliesToState("tx")).isTrue();
        assertThat(texas.appliesToState("CA")).isFalse();
    }

    @Test
    void readRules_missingResource_fails() {
        assertThatThrownBy(() -> seeder.readRules("classpath:no-such-rules.json"))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void onApplicationReady_seedsEmptyCollection() {
        when(complianceRuleRepository.count()).thenReturn(0L);

        seeder.onApplicationReady();

        verify(complianceRuleRepository).saveAll(anyList());
        verify(ruleCatalog).invalidate();
    }

    @Test
    void onApplicationReady_keepsExistingRules() {
        when(complianceRuleRepository.count()).thenReturn(3L);

        seeder.onApplicationReady();

        verify(complianceRuleRepository, never()).saveAll(anyList());
        verifyNoInteractions(ruleCatalog);
    }

    @Test
    void onApplicationReady_disabled() {
        properties.setSeedOnStartup(false);

        seeder.onApplicationReady();

        verifyNoInteractions(complianceRuleRepository, ruleCatalog);
    }
}
