package com.github.salilvnair.advisorengine.llm.model;

public record GenerationOutcome(
        String text,
        String provider,
        String model,
        int inputTokens,
        int outputTokens
) {}
