package com.github.salilvnair.advisorengine.engine.exception;

public class ResponseExtractionException extends AdvisorEngineException {

    public ResponseExtractionException(String message) {
        super(AdvisorEngineErrorCode.RESPONSE_EXTRACTION_FAILED, message);
    }
}
