package com.loanrecon.compliance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceConfig {
}
