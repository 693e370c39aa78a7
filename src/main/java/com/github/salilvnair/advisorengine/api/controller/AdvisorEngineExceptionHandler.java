package com.github.salilvnair.advisorengine.api.controller;

import com.github.salilvnair.advisorengine.api.dto.ErrorResponse;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine failures to a JSON body. Stack traces stay in the log.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {ConsultationController.class, CircuitBreakerController.class})
public class AdvisorEngineExceptionHandler {

    @ExceptionHandler(AdvisorEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(AdvisorEngineException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Engine failure [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        }
        else {
            log.warn("Rejected request [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable consultation payload: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(AdvisorEngineErrorCode.INVALID_REQUEST.name(), "Malformed JSON request body", false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected engine failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(
                        AdvisorEngineErrorCode.INTERNAL_ERROR.name(),
                        AdvisorEngineErrorCode.INTERNAL_ERROR.defaultMessage(),
                        false));
    }

    static HttpStatus statusFor(String errorCode) {
        if (AdvisorEngineErrorCode.INVALID_REQUEST.name().equals(errorCode)) {
            return HttpStatus.BAD_REQUEST;
        }
        if (AdvisorEngineErrorCode.CIRCUIT_NOT_FOUND.name().equals(errorCode)) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
