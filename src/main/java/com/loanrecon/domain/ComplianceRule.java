package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Externally curated, immutable rule definition. Empty loan type / state sets mean "all".
 */
@Document(collection = "compliance_rules")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ComplianceRule {

    @Id
    @EqualsAndHashCode.Include
    private String code;
    private String name;
    private String description;
    private RuleCategory category;
    private String regulationReference;
    private Severity severity;
    private Set<String> appliesToLoanTypes = new LinkedHashSet<>();
    private Set<String> appliesToStates = new LinkedHashSet<>();
    private LocalDate effectiveDate;
    /** Exclusive; null means open-ended. */
    private LocalDate expirationDate;
    private RuleLogic logic;
    private boolean requiresManualReview;
    private boolean active = true;
    private String remediationGuidance;

    public boolean appliesToLoanType(String loanType) {
        return appliesToLoanTypes == null || appliesToLoanTypes.isEmpty()
                || (loanType != null && containsIgnoreCase(appliesToLoanTypes, loanType));
    }

    public boolean appliesToState(String state) {
        return appliesToStates == null || appliesToStates.isEmpty()
                || (state != null && containsIgnoreCase(appliesToStates, state));
    }

    public boolean isEffectiveOn(LocalDate date) {
        if (date == null) {
            return true;
        }
        if (effectiveDate != null && date.isBefore(effectiveDate)) {
            return false;
        }
        return expirationDate == null || date.isBefore(expirationDate);
    }

    private static boolean containsIgnoreCase(Set<String> values, String candidate) {
        String c = candidate.trim().toUpperCase(Locale.ROOT);
        return values.stream().anyMatch(v -> v != null && v.trim().toUpperCase(Locale.ROOT).equals(c));
    }
}
