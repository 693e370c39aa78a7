package com.github.salilvnair.advisorengine.llm.core;

import com.github.salilvnair.advisorengine.resilience.CircuitBreaker;
import com.github.salilvnair.advisorengine.resilience.RetryPolicy;

/**
 * A provider together with the breaker and retry policy that guard it.
 */
public record ProviderChannel(
        GenerationProvider provider,
        CircuitBreaker breaker,
        RetryPolicy retryPolicy
) {

    public String name() {
        return provider.name();
    }
}
