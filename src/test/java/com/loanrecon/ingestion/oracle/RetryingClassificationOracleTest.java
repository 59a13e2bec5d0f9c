package com.loanrecon.ingestion.oracle;

import com.loanrecon.LoanFixtures;
import com.loanrecon.common.RetryPolicy;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.ingestion.content.DocumentContent;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryingClassificationOracleTest {

    private static final RetryPolicy NO_DELAY = new RetryPolicy(0L, 0L, 0.0, 3);

    @Mock
    ClassificationOracle delegate;
    @Mock
    RateLimiter rateLimiter;

    private final LoanDocument document = LoanFixtures.document("doc-1", 3);
    private final DocumentContent content = new DocumentContent("text", null);

    private RetryingClassificationOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new RetryingClassificationOracle(delegate, NO_DELAY, rateLimiter);
    }

    @Test
    @DisplayName("transient failures are retried until the oracle answers")
    void retriesTransientFailures() {
        OracleJudgment judgment = new OracleJudgment("appraisal", null, null, true, null, Map.of());
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(delegate.classify(any(), any()))
                .thenThrow(new TransientOracleException("503"))
                .thenReturn(judgment);

        assertThat(oracle.classify(document, content)).isSameAs(judgment);
        verify(delegate, times(2)).classify(document, content);
    }

    @Test
    @DisplayName("after max attempts the last transient failure is rethrown")
    void exhaustsAttempts() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(delegate.classify(any(), any())).thenThrow(new TransientOracleException("timeout"));

        assertThatThrownBy(() -> oracle.classify(document, content))
                .isInstanceOf(TransientOracleException.class)
                .hasMessage("timeout");
        verify(delegate, times(3)).classify(document, content);
    }

    @Test
    void nonTransientFailure_isNotRetried() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(delegate.classify(any(), any())).thenThrow(new OracleException("400 bad request"));

        assertThatThrownBy(() -> oracle.classify(document, content)).isInstanceOf(OracleException.class);
        verify(delegate, times(1)).classify(document, content);
    }

    @Test
    void limiterTimeout_countsAsTransientAttempt() {
        when(rateLimiter.acquirePermission()).thenReturn(false);

        assertThatThrownBy(() -> oracle.classify(document, content)).isInstanceOf(TransientOracleException.class);
        verify(delegate, times(0)).classify(any(), any());
    }
}
