package com.github.salilvnair.advisorengine.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingCircuitTransitionListener implements CircuitTransitionListener {

    @Override
    public void onTransition(String circuitName, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit breaker '{}' transition {} -> {}", circuitName, from.value(), to.value());
            return;
        }
        log.info("Circuit breaker '{}' transition {} -> {}", circuitName, from.value(), to.value());
    }
}
