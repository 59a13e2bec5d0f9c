package com.loanrecon.versioning.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ GroupingProperties.class, VersioningProperties.class })
public class VersioningConfig {
}
