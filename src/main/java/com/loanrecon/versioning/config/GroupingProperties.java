package com.loanrecon.versioning.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "loanrecon.grouping")
@NoArgsConstructor
@Getter
@Setter
public class GroupingProperties {

    /** Perceptual similarity at or above which two documents are the same instrument. Default 0.90. */
    private double similarityThreshold = 0.90;
}
