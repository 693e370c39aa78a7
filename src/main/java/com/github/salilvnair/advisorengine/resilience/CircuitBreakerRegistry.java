package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide home of every named breaker. Breaker state is local to this
 * JVM; separate workers each keep their own view.
 */
@Component
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitTransitionListener> listeners;
    private final Clock clock;

    @Autowired
    public CircuitBreakerRegistry(List<CircuitTransitionListener> listeners) {
        this(listeners, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(List<CircuitTransitionListener> listeners, Clock clock) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public CircuitBreaker register(String name, int failureThreshold, Duration recoveryTimeout) {
        return breakers.computeIfAbsent(normalize(name),
                key -> new CircuitBreaker(key, failureThreshold, recoveryTimeout, clock, listeners));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(normalize(name)));
    }

    public List<CircuitSnapshot> snapshots() {
        List<CircuitSnapshot> out = new ArrayList<>();
        breakers.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(breaker -> out.add(breaker.snapshot()));
        return out;
    }

    public CircuitSnapshot reset(String name) {
        CircuitBreaker breaker = find(name).orElseThrow(() -> new AdvisorEngineException(
                AdvisorEngineErrorCode.CIRCUIT_NOT_FOUND,
                "No circuit breaker registered with name " + normalize(name)));
        breaker.reset();
        return breaker.snapshot();
    }

    private String normalize(String name) {
        return name == null || name.isBlank() ? "unknown" : name.trim().toLowerCase(Locale.ROOT);
    }
}
