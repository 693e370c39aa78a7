package com.github.salilvnair.advisorengine.api.controller;

import com.github.salilvnair.advisorengine.api.dto.ErrorResponse;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.resilience.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdvisorEngineExceptionHandlerTest {

    private final AdvisorEngineExceptionHandler handler = new AdvisorEngineExceptionHandler();

    @Test
    void invalidRequestMapsToBadRequest() {
        ResponseEntity<ErrorResponse> response = handler.handleEngineException(
                new AdvisorEngineException(AdvisorEngineErrorCode.INVALID_REQUEST, "title required"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_REQUEST", response.getBody().errorCode());
        assertEquals("title required", response.getBody().message());
        assertFalse(response.getBody().recoverable());
    }

    @Test
    void unknownCircuitResetMapsToNotFound() {
        CircuitBreakerController controller = new CircuitBreakerController(new CircuitBreakerRegistry(List.of()));

        AdvisorEngineException thrown = assertThrows(AdvisorEngineException.class, () -> controller.reset("nope"));

        assertEquals(HttpStatus.NOT_FOUND, handler.handleEngineException(thrown).getStatusCode());
    }

    @Test
    void otherEngineErrorsMapToServerError() {
        ResponseEntity<ErrorResponse> response = handler.handleEngineException(
                new AdvisorEngineException(AdvisorEngineErrorCode.LLM_UNAVAILABLE));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertTrue(response.getBody().recoverable());
    }

    @Test
    void unexpectedErrorsHideTheirMessage() {
        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("secret detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(AdvisorEngineErrorCode.INTERNAL_ERROR.defaultMessage(), response.getBody().message());
    }

    @Test
    void circuitControllerResetsKnownBreaker() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(List.of());
        registry.register("vector-search", 1, Duration.ofSeconds(30)).recordFailure();
        CircuitBreakerController controller = new CircuitBreakerController(registry);

        assertEquals("open", controller.circuits().getBody().get(0).state().value());
        assertEquals(0, controller.reset("Vector-Search").getBody().failureCount());
    }
}
