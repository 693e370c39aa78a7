package com.github.salilvnair.advisorengine.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class AdvisorEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public AdvisorEngineException(
            AdvisorEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public AdvisorEngineException(
            AdvisorEngineErrorCode code,
            String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public AdvisorEngineException(
            AdvisorEngineErrorCode code,
            String overrideMessage,
            Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public AdvisorEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
