package com.github.salilvnair.advisorengine.engine.exception;

/**
 * Thrown by outbound adapters for failures worth retrying: timeouts, refused
 * connections and retryable HTTP status codes.
 */
public class TransientCallException extends AdvisorEngineException {

    public TransientCallException(String message) {
        super(AdvisorEngineErrorCode.TRANSIENT_CALL_FAILED, message);
    }

    public TransientCallException(String message, Throwable cause) {
        super(AdvisorEngineErrorCode.TRANSIENT_CALL_FAILED, message, cause);
    }
}
