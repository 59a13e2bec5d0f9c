package com.loanrecon.versioning.config;

import com.loanrecon.domain.VersionCriterion;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Version comparator precedence. DOCUMENT_ID is always appended as the final tie-break when absent.
 */
@ConfigurationProperties(prefix = "loanrecon.versioning")
@NoArgsConstructor
@Getter
@Setter
public class VersioningProperties {

    private List<VersionCriterion> defaultPrecedence = List.of(
            VersionCriterion.FINALITY,
            VersionCriterion.SIGNATURE,
            VersionCriterion.DOCUMENT_DATE,
            VersionCriterion.PAGE_COUNT,
            VersionCriterion.DOCUMENT_ID);

    /** Per instrument type override, e.g. appraisal_report: [DOCUMENT_DATE, FINALITY]. */
    private Map<String, List<VersionCriterion>> precedenceByType = new HashMap<>();
}
