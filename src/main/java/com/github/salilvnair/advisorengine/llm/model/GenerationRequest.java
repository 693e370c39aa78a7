package com.github.salilvnair.advisorengine.llm.model;

/**
 * One logical generation call. The fallback pair is what secondary providers
 * receive; when absent they fall back to the primary pair.
 *
 * @param maxTokens token ceiling, or {@code null} for the provider default
 */
public record GenerationRequest(
        String prompt,
        String systemPrompt,
        double temperature,
        Integer maxTokens,
        String fallbackPrompt,
        String fallbackSystemPrompt
) {

    public static final double DEFAULT_TEMPERATURE = 0.7d;

    public static GenerationRequest of(String prompt, String systemPrompt) {
        return new GenerationRequest(prompt, systemPrompt, DEFAULT_TEMPERATURE, null, null, null);
    }

    public GenerationRequest withFallback(String fallbackPrompt, String fallbackSystemPrompt) {
        return new GenerationRequest(prompt, systemPrompt, temperature, maxTokens, fallbackPrompt, fallbackSystemPrompt);
    }

    public GenerationRequest withTemperature(double newTemperature) {
        return new GenerationRequest(prompt, systemPrompt, newTemperature, maxTokens, fallbackPrompt, fallbackSystemPrompt);
    }

    /**
     * The request as a secondary provider sees it.
     */
    public GenerationRequest forFallback() {
        String nextPrompt = fallbackPrompt == null || fallbackPrompt.isBlank() ? prompt : fallbackPrompt;
        String nextSystem = fallbackSystemPrompt == null || fallbackSystemPrompt.isBlank() ? systemPrompt : fallbackSystemPrompt;
        return new GenerationRequest(nextPrompt, nextSystem, temperature, maxTokens, null, null);
    }
}
