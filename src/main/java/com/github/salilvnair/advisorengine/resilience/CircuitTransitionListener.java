package com.github.salilvnair.advisorengine.resilience;

/**
 * Observability sink for breaker transitions. Called once per transition,
 * outside the breaker lock. Implementations must not drive control flow.
 */
@FunctionalInterface
public interface CircuitTransitionListener {
    void onTransition(String circuitName, CircuitState from, CircuitState to);
}
