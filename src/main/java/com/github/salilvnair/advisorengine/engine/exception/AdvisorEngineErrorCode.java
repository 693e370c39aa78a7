package com.github.salilvnair.advisorengine.engine.exception;

public enum AdvisorEngineErrorCode {

    // =========================
    // Resilience errors
    // =========================
    CIRCUIT_OPEN(
            "Circuit breaker is open for dependency",
            true
    ),

    TRANSIENT_CALL_FAILED(
            "Outbound call failed with a transient error",
            true
    ),

    // =========================
    // Retrieval errors
    // =========================
    RETRIEVAL_FAILED(
            "Vector similarity search failed",
            false
    ),

    RETRIEVAL_UNAVAILABLE(
            "Vector similarity search is unavailable",
            true
    ),

    // =========================
    // LLM related errors
    // =========================
    LLM_CALL_FAILED(
            "LLM call failed",
            false
    ),

    LLM_AUTH_FAILED(
            "LLM provider rejected the credentials",
            false
    ),

    LLM_NOT_CONFIGURED(
            "LLM provider is not configured",
            false
    ),

    LLM_INVALID_RESPONSE(
            "LLM returned invalid response",
            false
    ),

    LLM_UNAVAILABLE(
            "All LLM providers failed",
            true
    ),

    // =========================
    // Prompt / output errors
    // =========================
    PROMPT_RENDER_FAILED(
            "Failed to render consultation prompt",
            false
    ),

    PROMPT_TEMPLATE_MISSING(
            "Prompt template could not be loaded",
            false
    ),

    RESPONSE_EXTRACTION_FAILED(
            "No valid JSON object found in LLM response",
            true
    ),

    // =========================
    // API errors
    // =========================
    INVALID_REQUEST(
            "Consultation request is missing required fields",
            false
    ),

    // =========================
    // Admin errors
    // =========================
    CIRCUIT_NOT_FOUND(
            "No circuit breaker registered with that name",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    AdvisorEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
