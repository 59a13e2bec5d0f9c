package com.loanrecon.ingestion.oracle;

import com.loanrecon.common.RetryPolicy;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.ingestion.content.DocumentContent;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorates a {@link ClassificationOracle} with the shared rate limiter and an explicit {@link RetryPolicy}.
 * Only {@link TransientOracleException} is retried; the last one is rethrown when attempts run out.
 */
@Slf4j
public class RetryingClassificationOracle implements ClassificationOracle {

    private final ClassificationOracle delegate;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;

    public RetryingClassificationOracle(ClassificationOracle delegate, RetryPolicy retryPolicy, RateLimiter rateLimiter) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public OracleJudgment classify(LoanDocument document, DocumentContent content) {
        TransientOracleException last = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 1) {
                long delay = retryPolicy.delayMs(attempt - 2);
                log.debug("Retrying oracle for document {} (attempt {}/{}) after {} ms",
                        document.getId(), attempt, retryPolicy.getMaxAttempts(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OracleException("Interrupted during oracle retry", e);
                }
            }
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new TransientOracleException("Local oracle limiter timeout for document " + document.getId());
                }
                return delegate.classify(document, content);
            } catch (TransientOracleException e) {
                last = e;
                log.warn("Transient oracle failure for document {} (attempt {}/{}): {}",
                        document.getId(), attempt, retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw last;
    }
}
