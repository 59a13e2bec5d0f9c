package com.loanrecon.ingestion.config;

import com.loanrecon.common.RetryPolicy;
import com.loanrecon.ingestion.content.DocumentContentStore;
import com.loanrecon.ingestion.content.FileSystemDocumentContentStore;
import com.loanrecon.ingestion.oracle.ClassificationOracle;
import com.loanrecon.ingestion.oracle.OracleResponseParser;
import com.loanrecon.ingestion.oracle.RetryingClassificationOracle;
import com.loanrecon.ingestion.oracle.WebClientClassificationOracle;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the oracle client (HTTP client decorated with retry + rate limit) and the content store.
 */
@Configuration
@EnableConfigurationProperties({ IntakeProperties.class, OracleProperties.class, ContentProperties.class })
public class IngestionConfig {

    @Bean(name = "oracleRateLimiter")
    public RateLimiter oracleRateLimiter(OracleProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("classification-oracle", config);
    }

    @Bean
    public RetryPolicy oracleRetryPolicy(OracleProperties properties) {
        OracleProperties.Retry r = properties.getRetry();
        return new RetryPolicy(r.getBaseDelayMs(), r.getMaxDelayMs(), r.getJitterFactor(), r.getMaxAttempts());
    }

    /** The only ClassificationOracle bean; callers always get the retrying, throttled client. */
    @Bean
    public ClassificationOracle classificationOracle(WebClient.Builder webClientBuilder,
                                                     OracleProperties properties,
                                                     OracleResponseParser parser,
                                                     RetryPolicy oracleRetryPolicy,
                                                     RateLimiter oracleRateLimiter) {
        WebClientClassificationOracle http = new WebClientClassificationOracle(
                webClientBuilder, properties.getBaseUrl(), Duration.ofMillis(properties.getTimeoutMs()), parser);
        return new RetryingClassificationOracle(http, oracleRetryPolicy, oracleRateLimiter);
    }

    @Bean
    public DocumentContentStore documentContentStore(ContentProperties properties) {
        return new FileSystemDocumentContentStore(Path.of(properties.getBaseDir()));
    }
}
