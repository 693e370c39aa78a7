package com.github.salilvnair.advisorengine.prompt;

import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;

/**
 * Full prompts for the primary provider and condensed prompts for fallbacks.
 */
public record PromptBundle(
        String prompt,
        String systemPrompt,
        String fallbackPrompt,
        String fallbackSystemPrompt
) {

    public GenerationRequest toRequest(double temperature) {
        return new GenerationRequest(prompt, systemPrompt, temperature, null, fallbackPrompt, fallbackSystemPrompt);
    }
}
