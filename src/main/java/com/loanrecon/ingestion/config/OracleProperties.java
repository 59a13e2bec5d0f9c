package com.loanrecon.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Classification oracle endpoint, throttling and retry policy. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "loanrecon.oracle")
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    /** Base URL of the classification service; requests go to {baseUrl}/classify. */
    private String baseUrl = "http://localhost:8090";

    /** Per-request response timeout. */
    private long timeoutMs = 30_000;

    /** Global oracle budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 5;

    /** How long the local limiter may wait for a permit before the call counts as a transient failure. */
    private long localLimiterTimeoutMs = 5_000;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Base delay in ms for first retry; doubles each attempt. Default 500. */
        private long baseDelayMs = 500L;

        /** Backoff ceiling in ms. Default 8000. */
        private long maxDelayMs = 8_000L;

        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
        private double jitterFactor = 0.2;

        /** Total attempts including the first call. Default 4. */
        private int maxAttempts = 4;
    }
}
