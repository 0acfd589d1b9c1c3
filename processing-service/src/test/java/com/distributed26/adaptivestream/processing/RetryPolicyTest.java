package com.distributed26.adaptivestream.processing;

import static org.junit.jupiter.api.Assertions.*;

import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void defaults_threeAttemptsWithDoublingDelay() {
        RetryPolicy policy = RetryPolicy.from(PipelineConfig.defaults());

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(2_000, policy.delayMillis(1));
        assertEquals(4_000, policy.delayMillis(2));
        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void delay_isCappedAtMax() {
        RetryPolicy policy = new RetryPolicy(10, 2_000, 30_000);

        assertEquals(16_000, policy.delayMillis(4));
        assertEquals(30_000, policy.delayMillis(5));
        assertEquals(30_000, policy.delayMillis(60));
    }

    @Test
    void noAttemptsMade_noDelay() {
        assertEquals(0, new RetryPolicy(3, 2_000, 30_000).delayMillis(0));
    }

    @Test
    void invalidArguments_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 10, 5));
    }
}
