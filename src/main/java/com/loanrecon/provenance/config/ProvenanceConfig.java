package com.loanrecon.provenance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ProvenanceProperties.class)
public class ProvenanceConfig {
}
