package com.loanrecon.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 10_000L, 0.2, 4);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 10_000L, 0, 4);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_isCappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(500L, 8_000L, 0, 4);
        assertThat(policy.delayMs(4)).isEqualTo(8_000L);
        assertThat(policy.delayMs(30)).isEqualTo(8_000L);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(4);
    }

    @Test
    void maxAttemptsBelowOne_isRejected() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 1000L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
