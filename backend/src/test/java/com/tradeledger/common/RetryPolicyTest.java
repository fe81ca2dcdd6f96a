package com.tradeledger.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5, 60_000L);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5, 60_000L);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_cappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0, 10, 5000L);
        assertThat(policy.delayMs(3)).isEqualTo(5000L);
        assertThat(policy.delayMs(40)).isEqualTo(5000L);
    }

    @Test
    void zeroDelays_neverSleep() {
        RetryPolicy policy = new RetryPolicy(0L, 0, 3, 0L);
        assertThat(policy.delayMs(0)).isZero();
        assertThat(policy.delayMs(2)).isZero();
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0.1, 0, 1000L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(5);
        assertThat(RetryPolicy.defaultPolicy().getMaxDelayMs()).isEqualTo(60_000L);
    }
}
