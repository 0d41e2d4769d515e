package com.hubsync.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_doublesPerAttemptWithoutJitter() {
        RetryPolicy policy = new RetryPolicy(100L, 10_000L, 0, 5);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
        assertThat(policy.delayMs(3)).isEqualTo(800L);
    }

    @Test
    void delayMs_cappedAtMax() {
        RetryPolicy policy = new RetryPolicy(1_000L, 5_000L, 0, 5);
        assertThat(policy.delayMs(10)).isEqualTo(5_000L);
        assertThat(policy.delayMs(60)).isEqualTo(5_000L);
    }

    @Test
    void delayMs_jitterStaysWithinFactor() {
        RetryPolicy policy = new RetryPolicy(1_000L, 30_000L, 0.2, 5);
        for (int i = 0; i < 100; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1_200L);
        }
    }

    @Test
    void sleep_returnsFalseAndKeepsInterruptFlag() {
        RetryPolicy policy = new RetryPolicy(1_000L, 1_000L, 0, 1);
        Thread.currentThread().interrupt();
        try {
            assertThat(policy.sleep(0)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void constructor_maxBelowBase_throws() {
        assertThatThrownBy(() -> new RetryPolicy(1_000L, 10L, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_fiveAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(5);
    }
}
