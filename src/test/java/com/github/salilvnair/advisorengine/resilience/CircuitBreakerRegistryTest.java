package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerRegistryTest {

    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry(List.of(), new MutableClock());

    @Test
    void registerReturnsTheSameBreakerForTheSameName() {
        CircuitBreaker first = registry.register("llm-ollama", 5, Duration.ofSeconds(60));
        CircuitBreaker second = registry.register(" LLM-Ollama ", 2, Duration.ofSeconds(1));

        assertSame(first, second);
        assertEquals(5, second.getFailureThreshold());
    }

    @Test
    void snapshotsAreSortedByName() {
        registry.register("vector-search", 5, Duration.ofSeconds(60));
        registry.register("llm-anthropic", 5, Duration.ofSeconds(60));

        List<String> names = registry.snapshots().stream().map(CircuitSnapshot::name).toList();

        assertEquals(List.of("llm-anthropic", "vector-search"), names);
    }

    @Test
    void resetClosesAnOpenBreaker() {
        CircuitBreaker breaker = registry.register("vector-search", 1, Duration.ofSeconds(60));
        breaker.recordFailure();

        CircuitSnapshot snapshot = registry.reset("vector-search");

        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void resetUnknownBreakerFails() {
        AdvisorEngineException thrown = assertThrows(AdvisorEngineException.class, () -> registry.reset("missing"));

        assertEquals(AdvisorEngineErrorCode.CIRCUIT_NOT_FOUND.name(), thrown.getErrorCode());
    }
}
