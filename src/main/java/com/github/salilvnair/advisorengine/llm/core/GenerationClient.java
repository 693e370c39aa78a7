package com.github.salilvnair.advisorengine.llm.core;

import com.github.salilvnair.advisorengine.engine.exception.CircuitBreakerOpenException;
import com.github.salilvnair.advisorengine.engine.exception.GenerationUnavailableException;
import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;
import com.github.salilvnair.advisorengine.resilience.CircuitState;
import com.github.salilvnair.advisorengine.resilience.ResilientInvoker;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generation entry point. Holds a prioritised list of provider channels: the
 * first is the primary and receives the full prompts, the rest are fallbacks
 * and receive the condensed prompts. In stub mode every call is answered by
 * the offline stub without touching any breaker.
 */
@Slf4j
public class GenerationClient {

    static final String JSON_INSTRUCTION = "\n\nYou must respond ONLY with valid JSON. "
            + "Do not include any text before or after the JSON object.";

    private final List<ProviderChannel> channels;
    private final GenerationProvider stubProvider;
    private final boolean stubEnabled;
    private final boolean fallbackEnabled;
    private final ResilientInvoker invoker;

    public GenerationClient(
            List<ProviderChannel> channels,
            GenerationProvider stubProvider,
            boolean stubEnabled,
            boolean fallbackEnabled,
            ResilientInvoker invoker
    ) {
        this.channels = channels == null ? List.of() : List.copyOf(channels);
        this.stubProvider = stubProvider;
        this.stubEnabled = stubEnabled && stubProvider != null;
        this.fallbackEnabled = fallbackEnabled;
        this.invoker = invoker == null ? new ResilientInvoker() : invoker;
    }

    public GenerationOutcome generate(GenerationRequest request) {
        if (stubEnabled) {
            log.debug("Stub mode active, answering with {}", stubProvider.name());
            return stubProvider.generate(request);
        }
        if (channels.isEmpty()) {
            throw new GenerationUnavailableException("No generation provider configured");
        }

        RuntimeException lastFailure = null;
        for (int i = 0; i < channels.size(); i++) {
            ProviderChannel channel = channels.get(i);
            boolean primary = i == 0;
            if (!primary && !fallbackEnabled) {
                break;
            }
            GenerationRequest effective = primary ? request : request.forFallback();
            try {
                GenerationOutcome outcome = invoker.call(
                        channel.breaker(),
                        channel.retryPolicy(),
                        () -> channel.provider().generate(effective));
                if (!primary) {
                    log.info("Generation served by fallback provider {} ({})", channel.name(), outcome.model());
                }
                return outcome;
            } catch (CircuitBreakerOpenException open) {
                log.warn("Skipping provider {}: {}", channel.name(), open.getMessage());
                lastFailure = open;
            } catch (RuntimeException failure) {
                log.warn("Provider {} failed: {}", channel.name(), failure.getMessage());
                lastFailure = failure;
            }
        }

        log.error("All generation providers failed");
        throw new GenerationUnavailableException("No generation provider succeeded", lastFailure);
    }

    /**
     * Same as {@link #generate(GenerationRequest)} with a JSON-only instruction
     * appended to both system prompts.
     */
    public GenerationOutcome generateJson(GenerationRequest request) {
        String system = (request.systemPrompt() == null ? "" : request.systemPrompt()) + JSON_INSTRUCTION;
        String fallbackSystem = request.fallbackSystemPrompt() == null || request.fallbackSystemPrompt().isBlank()
                ? system
                : request.fallbackSystemPrompt() + JSON_INSTRUCTION;
        return generate(new GenerationRequest(
                request.prompt(),
                system,
                request.temperature(),
                request.maxTokens(),
                request.fallbackPrompt(),
                fallbackSystem));
    }

    /**
     * Health of every provider keyed by name, in priority order. A provider
     * whose breaker is open reports unhealthy without being probed.
     */
    public Map<String, Boolean> health() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        if (stubEnabled) {
            out.put(stubProvider.name(), stubProvider.isHealthy());
            return out;
        }
        for (ProviderChannel channel : channels) {
            if (channel.breaker().state() == CircuitState.OPEN) {
                out.put(channel.name(), false);
                continue;
            }
            boolean healthy;
            try {
                healthy = channel.provider().isHealthy();
            } catch (RuntimeException e) {
                log.warn("Health check for {} failed: {}", channel.name(), e.getMessage());
                healthy = false;
            }
            out.put(channel.name(), healthy);
        }
        return out;
    }

    public boolean isHealthy() {
        return health().values().stream().anyMatch(Boolean::booleanValue);
    }

    public boolean isStubEnabled() {
        return stubEnabled;
    }

    public List<ProviderChannel> getChannels() {
        return channels;
    }
}
