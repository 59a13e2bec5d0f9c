package com.loanrecon.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of extracted document content: {baseDir}/{storageKey}.txt and {baseDir}/{storageKey}.png.
 */
@ConfigurationProperties(prefix = "loanrecon.content")
@NoArgsConstructor
@Getter
@Setter
public class ContentProperties {

    private String baseDir = "./data/content";
}
