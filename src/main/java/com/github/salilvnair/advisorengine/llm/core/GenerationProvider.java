package com.github.salilvnair.advisorengine.llm.core;

import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;
import com.github.salilvnair.advisorengine.llm.model.ProviderKind;

/**
 * Adapter for one text-generation backend. Implementations perform a single
 * attempt; retry and breaker handling belong to {@link GenerationClient}.
 */
public interface GenerationProvider {

    ProviderKind kind();

    String model();

    GenerationOutcome generate(GenerationRequest request);

    boolean isHealthy();

    default String name() {
        return kind().value();
    }
}
