package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.CircuitBreakerOpenException;
import com.github.salilvnair.advisorengine.engine.exception.TransientCallException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Runs one logical call against a breaker-protected dependency.
 * <p>
 * Transient failures are retried in-process with exponential backoff. The
 * breaker hears about the logical call exactly once: a success, or a single
 * failure once attempts are exhausted or a non-retryable error occurs.
 */
@Slf4j
public class ResilientInvoker {

    private final Sleeper sleeper;

    public ResilientInvoker() {
        this(Sleeper.THREAD);
    }

    public ResilientInvoker(Sleeper sleeper) {
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public <T> T call(CircuitBreaker breaker, RetryPolicy policy, Supplier<T> call) {
        if (!breaker.allowRequest()) {
            throw new CircuitBreakerOpenException(breaker.getName(), breaker.getRecoveryTimeout());
        }

        int attempt = 1;
        long backoffMs = policy.initialBackoffMs();

        while (true) {
            try {
                T result = call.get();
                breaker.recordSuccess();
                return result;
            } catch (RuntimeException failure) {
                if (!policy.isRetryable(failure)) {
                    log.warn("Call to '{}' failed with non-retryable error: {}", breaker.getName(), failure.getMessage());
                    breaker.recordFailure();
                    throw failure;
                }
                if (attempt >= policy.maxAttempts()) {
                    log.warn("Call to '{}' failed after {} attempt(s): {}", breaker.getName(), attempt, failure.getMessage());
                    breaker.recordFailure();
                    throw failure;
                }
                log.warn("Call to '{}' attempt {}/{} failed ({}), retrying in {}ms",
                        breaker.getName(), attempt, policy.maxAttempts(), failure.getMessage(), backoffMs);
            }

            try {
                sleeper.sleep(backoffMs);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                breaker.recordFailure();
                throw new TransientCallException("Call to '" + breaker.getName() + "' interrupted during backoff", interrupted);
            }
            backoffMs = policy.nextBackoffMs(backoffMs);
            attempt++;
        }
    }
}
