package com.loanrecon.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Document intake (fingerprinting + classification) settings.
 */
@ConfigurationProperties(prefix = "loanrecon.intake")
@NoArgsConstructor
@Getter
@Setter
public class IntakeProperties {

    /** Max documents fingerprinted or classified concurrently per run. Also sizes intake-executor. Default 4. */
    private int concurrency = 4;

    /** Normalized text must be longer than this to be hashed instead of the first-page image. Default 50. */
    private int minTextChars = 50;

    /** Reuse a CLASSIFIED judgment when the document's exact hash is unchanged. Default true. */
    private boolean reuseClassifications = true;
}
