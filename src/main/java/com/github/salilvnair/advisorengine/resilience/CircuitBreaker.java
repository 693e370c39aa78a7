package com.github.salilvnair.advisorengine.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state failure isolation for one external dependency.
 * <p>
 * CLOSED lets every request through and counts consecutive failures; reaching
 * the threshold opens the circuit. OPEN rejects requests until the recovery
 * timeout has elapsed since the last failure, after which the next state read
 * moves to HALF_OPEN. In HALF_OPEN requests pass as probes: a success closes
 * the circuit, a failure reopens it immediately.
 * <p>
 * All state is guarded by a single lock per instance. Listeners are notified
 * after the lock is released, once per transition.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final List<CircuitTransitionListener> listeners;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, Clock.systemUTC(), List.of());
    }

    public CircuitBreaker(
            String name,
            int failureThreshold,
            Duration recoveryTimeout,
            Clock clock,
            List<CircuitTransitionListener> listeners
    ) {
        this.name = name;
        this.failureThreshold = Math.max(failureThreshold, 1);
        this.recoveryTimeout = recoveryTimeout == null || recoveryTimeout.isNegative()
                ? Duration.ZERO
                : recoveryTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public String getName() {
        return name;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * Current state. Reading it may move an expired OPEN circuit to HALF_OPEN.
     */
    public CircuitState state() {
        Transition transition;
        CircuitState current;
        lock.lock();
        try {
            transition = checkRecoveryTimeout();
            current = state;
        } finally {
            lock.unlock();
        }
        publish(transition);
        return current;
    }

    public int failureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean allowRequest() {
        Transition transition;
        boolean allowed;
        lock.lock();
        try {
            transition = checkRecoveryTimeout();
            allowed = state != CircuitState.OPEN;
        } finally {
            lock.unlock();
        }
        publish(transition);
        return allowed;
    }

    public void recordSuccess() {
        Transition transition;
        lock.lock();
        try {
            boolean wasHalfOpen = state == CircuitState.HALF_OPEN;
            failureCount = 0;
            transition = transitionTo(CircuitState.CLOSED);
            if (wasHalfOpen) {
                log.info("Circuit breaker '{}' CLOSED after successful probe", name);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    public void recordFailure() {
        Transition transition = null;
        lock.lock();
        try {
            failureCount++;
            lastFailureAt = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                log.warn("Circuit breaker '{}' OPEN after failed probe", name);
                transition = transitionTo(CircuitState.OPEN);
            }
            else if (failureCount >= failureThreshold) {
                if (state != CircuitState.OPEN) {
                    log.warn("Circuit breaker '{}' OPEN after {} consecutive failures. Will retry in {}s",
                            name, failureCount, recoveryTimeout.toSeconds());
                }
                transition = transitionTo(CircuitState.OPEN);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * Administrative reset back to CLOSED with a cleared failure history.
     */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            failureCount = 0;
            lastFailureAt = null;
            transition = transitionTo(CircuitState.CLOSED);
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    public CircuitSnapshot snapshot() {
        Transition transition;
        CircuitSnapshot snapshot;
        lock.lock();
        try {
            transition = checkRecoveryTimeout();
            snapshot = new CircuitSnapshot(
                    name,
                    state,
                    failureCount,
                    failureThreshold,
                    recoveryTimeout.toMillis(),
                    lastFailureAt);
        } finally {
            lock.unlock();
        }
        publish(transition);
        return snapshot;
    }

    // caller holds the lock
    private Transition checkRecoveryTimeout() {
        if (state != CircuitState.OPEN || lastFailureAt == null) {
            return null;
        }
        Duration elapsed = Duration.between(lastFailureAt, clock.instant());
        if (elapsed.compareTo(recoveryTimeout) < 0) {
            return null;
        }
        log.info("Circuit breaker '{}' transitioning to HALF_OPEN after {}s recovery timeout",
                name, recoveryTimeout.toSeconds());
        return transitionTo(CircuitState.HALF_OPEN);
    }

    // caller holds the lock
    private Transition transitionTo(CircuitState next) {
        if (state == next) {
            return null;
        }
        CircuitState from = state;
        state = next;
        return new Transition(from, next);
    }

    private void publish(Transition transition) {
        if (transition == null) {
            return;
        }
        for (CircuitTransitionListener listener : listeners) {
            try {
                listener.onTransition(name, transition.from(), transition.to());
            } catch (RuntimeException e) {
                log.warn("Circuit transition listener failed for '{}': {}", name, e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker(name='" + name + "', state='" + state.value()
                + "', failures=" + failureCount + "/" + failureThreshold + ")";
    }

    private record Transition(CircuitState from, CircuitState to) {}
}
