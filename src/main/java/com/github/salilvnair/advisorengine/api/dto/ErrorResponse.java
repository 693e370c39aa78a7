package com.github.salilvnair.advisorengine.api.dto;

public record ErrorResponse(
        String errorCode,
        String message,
        boolean recoverable
) {}
