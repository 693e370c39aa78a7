package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.advisorengine.support.TestConstants.BOOM;
import static com.github.salilvnair.advisorengine.support.TestConstants.CIRCUIT_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofSeconds(60);

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        transitions = new ArrayList<>();
        CircuitTransitionListener recorder = (name, from, to) -> transitions.add(from + "->" + to);
        breaker = new CircuitBreaker(CIRCUIT_NAME, 3, RECOVERY, clock, List.of(recorder));
    }

    @Test
    void staysClosedBelowThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertTrue(breaker.allowRequest());
        assertEquals(2, breaker.failureCount());
    }

    @Test
    void opensWhenConsecutiveFailuresReachThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.state());
        assertFalse(breaker.allowRequest());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void successClearsConsecutiveFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(2, breaker.failureCount());
    }

    @Test
    void openStaysOpenUntilRecoveryTimeoutElapses() {
        tripOpen();

        clock.advance(RECOVERY.minusSeconds(1));
        assertEquals(CircuitState.OPEN, breaker.state());
        assertFalse(breaker.allowRequest());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void halfOpenProbeSuccessCloses() {
        tripOpen();
        clock.advance(RECOVERY);
        assertTrue(breaker.allowRequest());

        breaker.recordSuccess();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(0, breaker.failureCount());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void halfOpenProbeFailureReopensImmediately() {
        CircuitBreaker lenient = new CircuitBreaker(CIRCUIT_NAME, 5, RECOVERY, clock, List.of());
        for (int i = 0; i < 5; i++) {
            lenient.recordFailure();
        }
        clock.advance(RECOVERY);
        assertEquals(CircuitState.HALF_OPEN, lenient.state());

        lenient.recordFailure();

        assertEquals(CircuitState.OPEN, lenient.state());
        assertFalse(lenient.allowRequest());
    }

    @Test
    void reopenedCircuitWaitsAFullRecoveryTimeoutAgain() {
        tripOpen();
        clock.advance(RECOVERY);
        breaker.allowRequest();
        breaker.recordFailure();

        clock.advance(RECOVERY.minusSeconds(1));

        assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    void resetClosesAndClearsHistory() {
        tripOpen();

        breaker.reset();

        CircuitSnapshot snapshot = breaker.snapshot();
        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.failureCount());
        assertNull(snapshot.lastFailureAt());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void failingListenerDoesNotAffectTransitions() {
        CircuitTransitionListener failing = (name, from, to) -> {
            throw new IllegalStateException(BOOM);
        };
        CircuitBreaker guarded = new CircuitBreaker(CIRCUIT_NAME, 1, RECOVERY, clock, List.of(failing));

        guarded.recordFailure();

        assertEquals(CircuitState.OPEN, guarded.state());
    }

    @Test
    void thresholdBelowOneIsTreatedAsOne() {
        CircuitBreaker eager = new CircuitBreaker(CIRCUIT_NAME, 0, RECOVERY);

        eager.recordFailure();

        assertEquals(1, eager.getFailureThreshold());
        assertEquals(CircuitState.OPEN, eager.state());
    }

    @Test
    void concurrentFailuresOpenExactlyOnce() throws Exception {
        int callers = 16;
        List<String> seen = new CopyOnWriteArrayList<>();
        CircuitTransitionListener recorder = (name, from, to) -> seen.add(from + "->" + to);
        CircuitBreaker shared = new CircuitBreaker(CIRCUIT_NAME, callers, RECOVERY, clock, List.of(recorder));
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    shared.recordFailure();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(CircuitState.OPEN, shared.state());
        assertEquals(callers, shared.failureCount());
        assertEquals(List.of("CLOSED->OPEN"), seen);
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.state());
    }
}
