package com.github.salilvnair.advisorengine.engine.exception;

public class RetrievalUnavailableException extends AdvisorEngineException {

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(AdvisorEngineErrorCode.RETRIEVAL_UNAVAILABLE, message, cause);
    }
}
