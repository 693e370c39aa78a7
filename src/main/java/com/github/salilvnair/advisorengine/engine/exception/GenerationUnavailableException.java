package com.github.salilvnair.advisorengine.engine.exception;

public class GenerationUnavailableException extends AdvisorEngineException {

    public GenerationUnavailableException(String message) {
        super(AdvisorEngineErrorCode.LLM_UNAVAILABLE, message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(AdvisorEngineErrorCode.LLM_UNAVAILABLE, message, cause);
    }
}
