package com.github.salilvnair.advisorengine.engine.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class CircuitBreakerOpenException extends AdvisorEngineException {

    private final String circuitName;
    private final Duration recoveryTimeout;

    public CircuitBreakerOpenException(String circuitName, Duration recoveryTimeout) {
        super(AdvisorEngineErrorCode.CIRCUIT_OPEN,
                "Circuit breaker '" + circuitName + "' is open. Will retry in "
                        + recoveryTimeout.toSeconds() + "s");
        this.circuitName = circuitName;
        this.recoveryTimeout = recoveryTimeout;
    }
}
