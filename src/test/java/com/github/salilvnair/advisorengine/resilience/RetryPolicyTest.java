package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.TransientCallException;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void worstCaseBackoffSumsSleepsBetweenAttempts() {
        assertEquals(3000L, RetryPolicy.of(3, 1000, 8000, 2.0).worstCaseBackoffMs());
        assertEquals(0L, RetryPolicy.noRetry().worstCaseBackoffMs());
    }

    @Test
    void invalidValuesAreClamped() {
        RetryPolicy policy = RetryPolicy.of(0, -5, -1, 0.5);

        assertEquals(1, policy.maxAttempts());
        assertEquals(0L, policy.initialBackoffMs());
        assertEquals(0L, policy.maxBackoffMs());
        assertEquals(1.0d, policy.backoffMultiplier());
    }

    @Test
    void retryableMatchesTypesAnywhereInCauseChain() {
        RetryPolicy policy = RetryPolicy.of(3, 10, 100, 2.0);

        assertTrue(policy.isRetryable(new TransientCallException("x")));
        assertTrue(policy.isRetryable(new RuntimeException(new ConnectException("refused"))));
        assertFalse(policy.isRetryable(new IllegalArgumentException("bad input")));
        assertFalse(RetryPolicy.noRetry().isRetryable(new TransientCallException("x")));
    }
}
