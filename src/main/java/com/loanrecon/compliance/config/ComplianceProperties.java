package com.loanrecon.compliance.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "loanrecon.compliance")
@NoArgsConstructor
@Getter
@Setter
public class ComplianceProperties {

    /** Seed compliance_rules from {@link #seedLocation} at startup when the collection is empty. Default true. */
    private boolean seedOnStartup = true;

    private String seedLocation = "classpath:compliance-rules.json";

    /** Per-rule evaluation budget; a rule exceeding it is reported as ERROR. */
    private long ruleTimeoutMs = 10_000;
}
