package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.CircuitBreakerOpenException;
import com.github.salilvnair.advisorengine.engine.exception.TransientCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.advisorengine.support.TestConstants.BOOM;
import static com.github.salilvnair.advisorengine.support.TestConstants.CIRCUIT_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResilientInvokerTest {

    private List<Long> sleeps;
    private ResilientInvoker invoker;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        invoker = new ResilientInvoker(sleeps::add);
        breaker = new CircuitBreaker(CIRCUIT_NAME, 5, Duration.ofSeconds(60));
    }

    @Test
    void retriesTransientFailuresWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = invoker.call(breaker, RetryPolicy.of(3, 1000, 5000, 2.0), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientCallException(BOOM);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1000L, 2000L), sleeps);
        assertEquals(0, breaker.failureCount());
    }

    @Test
    void exhaustedRetriesRecordExactlyOneBreakerFailure() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientCallException.class, () -> invoker.call(breaker, RetryPolicy.of(3, 10, 100, 2.0), () -> {
            calls.incrementAndGet();
            throw new TransientCallException(BOOM);
        }));

        assertEquals(3, calls.get());
        assertEquals(1, breaker.failureCount());
    }

    @Test
    void nonRetryableFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException failure = new IllegalStateException(BOOM);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> invoker.call(breaker, RetryPolicy.of(3, 10, 100, 2.0), () -> {
                    calls.incrementAndGet();
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(1, calls.get());
        assertEquals(1, breaker.failureCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void timeoutInCauseChainIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = invoker.call(breaker, RetryPolicy.of(2, 5, 5, 1.0), () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("wrapped", new HttpTimeoutException("timed out"));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(5L), sleeps);
    }

    @Test
    void backoffIsCappedAtMaximum() {
        assertThrows(TransientCallException.class, () -> invoker.call(breaker, RetryPolicy.of(4, 1000, 1500, 2.0), () -> {
            throw new TransientCallException(BOOM);
        }));

        assertEquals(List.of(1000L, 1500L, 1500L), sleeps);
    }

    @Test
    void openBreakerRejectsWithoutInvoking() {
        CircuitBreaker open = new CircuitBreaker(CIRCUIT_NAME, 1, Duration.ofSeconds(60));
        open.recordFailure();
        AtomicInteger calls = new AtomicInteger();

        CircuitBreakerOpenException thrown = assertThrows(CircuitBreakerOpenException.class,
                () -> invoker.call(open, RetryPolicy.noRetry(), calls::incrementAndGet));

        assertEquals(CIRCUIT_NAME, thrown.getCircuitName());
        assertEquals(0, calls.get());
        assertEquals(1, open.failureCount());
    }

    @Test
    void interruptedBackoffSurfacesAsTransientFailure() {
        ResilientInvoker interrupting = new ResilientInvoker(millis -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThrows(TransientCallException.class, () -> interrupting.call(breaker, RetryPolicy.of(3, 10, 10, 1.0), () -> {
                throw new TransientCallException(BOOM);
            }));
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, breaker.failureCount());
        } finally {
            Thread.interrupted();
        }
    }
}
