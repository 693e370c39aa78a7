package com.github.salilvnair.advisorengine.config;

import com.github.salilvnair.advisorengine.llm.core.GenerationClient;
import com.github.salilvnair.advisorengine.llm.core.GenerationProvider;
import com.github.salilvnair.advisorengine.llm.core.ProviderChannel;
import com.github.salilvnair.advisorengine.llm.model.ProviderKind;
import com.github.salilvnair.advisorengine.llm.provider.AnthropicGenerationProvider;
import com.github.salilvnair.advisorengine.llm.provider.OfflineStubGenerationProvider;
import com.github.salilvnair.advisorengine.llm.provider.OllamaGenerationProvider;
import com.github.salilvnair.advisorengine.resilience.CircuitBreaker;
import com.github.salilvnair.advisorengine.resilience.CircuitBreakerRegistry;
import com.github.salilvnair.advisorengine.resilience.ResilientInvoker;
import com.github.salilvnair.advisorengine.resilience.RetryPolicy;
import com.github.salilvnair.advisorengine.retrieval.HttpVectorSearchService;
import com.github.salilvnair.advisorengine.retrieval.RetrievalClient;
import com.github.salilvnair.advisorengine.retrieval.VectorSearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the outbound clients once per context. Each dependency gets its own
 * breaker from the registry so the admin endpoints can see and reset it.
 */
@Slf4j
@Configuration
public class AdvisorEngineClientConfig {

    public static final String VECTOR_SEARCH_CIRCUIT = "vector-search";
    public static final String LLM_CIRCUIT_PREFIX = "llm-";

    @Bean
    @ConditionalOnMissingBean
    public ResilientInvoker resilientInvoker() {
        return new ResilientInvoker();
    }

    @Bean
    public OfflineStubGenerationProvider offlineStubGenerationProvider() {
        return new OfflineStubGenerationProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorSearchService vectorSearchService(AdvisorEngineRetrievalConfig retrievalConfig) {
        return new HttpVectorSearchService(retrievalConfig, httpClient(retrievalConfig.getConnectTimeoutMs()));
    }

    @Bean
    public RetrievalClient retrievalClient(
            VectorSearchService vectorSearchService,
            AdvisorEngineRetrievalConfig retrievalConfig,
            CircuitBreakerRegistry registry,
            ResilientInvoker invoker
    ) {
        CircuitBreaker breaker = registry.register(
                VECTOR_SEARCH_CIRCUIT,
                retrievalConfig.getCircuit().getFailureThreshold(),
                retrievalConfig.getCircuit().recoveryTimeout());
        return new RetrievalClient(
                vectorSearchService,
                breaker,
                retrievalConfig.getRetry().toPolicy(),
                invoker,
                retrievalConfig.getTopK());
    }

    @Bean
    public GenerationClient generationClient(
            AdvisorEngineLlmConfig llmConfig,
            CircuitBreakerRegistry registry,
            ResilientInvoker invoker,
            OfflineStubGenerationProvider stubProvider
    ) {
        List<ProviderChannel> channels = new ArrayList<>();
        for (ProviderKind kind : providerOrder(llmConfig)) {
            ProviderChannel channel = channel(kind, llmConfig, registry, stubProvider);
            if (channel != null) {
                channels.add(channel);
            }
        }
        if (llmConfig.isStubEnabled()) {
            log.info("Generation stub mode enabled, providers will not be called");
        }
        else {
            log.info("Generation providers in priority order: {}", channels.stream().map(ProviderChannel::name).toList());
        }
        return new GenerationClient(channels, stubProvider, llmConfig.isStubEnabled(), llmConfig.isFallbackEnabled(), invoker);
    }

    private Set<ProviderKind> providerOrder(AdvisorEngineLlmConfig llmConfig) {
        Set<ProviderKind> order = new LinkedHashSet<>();
        if (llmConfig.getPrimary() != null) {
            order.add(llmConfig.getPrimary());
        }
        if (llmConfig.getFallbacks() != null) {
            llmConfig.getFallbacks().stream().filter(kind -> kind != null).forEach(order::add);
        }
        return order;
    }

    private ProviderChannel channel(
            ProviderKind kind,
            AdvisorEngineLlmConfig llmConfig,
            CircuitBreakerRegistry registry,
            OfflineStubGenerationProvider stubProvider
    ) {
        switch (kind) {
            case ANTHROPIC -> {
                AdvisorEngineLlmConfig.Anthropic anthropic = llmConfig.getAnthropic();
                if (anthropic.getApiKey() == null || anthropic.getApiKey().isBlank()) {
                    log.warn("Anthropic provider skipped: no API key configured");
                    return null;
                }
                GenerationProvider provider = new AnthropicGenerationProvider(
                        anthropic, httpClient(anthropic.getConnectTimeoutMs()));
                return guarded(provider, anthropic.getCircuit(), anthropic.getRetry().toPolicy(), registry);
            }
            case OLLAMA -> {
                AdvisorEngineLlmConfig.Ollama ollama = llmConfig.getOllama();
                if (!ollama.isEnabled()) {
                    log.info("Ollama provider disabled");
                    return null;
                }
                GenerationProvider provider = new OllamaGenerationProvider(
                        ollama, httpClient(ollama.getConnectTimeoutMs()));
                return guarded(provider, ollama.getCircuit(), ollama.getRetry().toPolicy(), registry);
            }
            case STUB -> {
                return guarded(stubProvider, new ResilienceProperties.Circuit(), RetryPolicy.noRetry(), registry);
            }
            default -> {
                return null;
            }
        }
    }

    private ProviderChannel guarded(
            GenerationProvider provider,
            ResilienceProperties.Circuit circuit,
            RetryPolicy retryPolicy,
            CircuitBreakerRegistry registry
    ) {
        CircuitBreaker breaker = registry.register(
                LLM_CIRCUIT_PREFIX + provider.kind().value(),
                circuit.getFailureThreshold(),
                circuit.recoveryTimeout());
        return new ProviderChannel(provider, breaker, retryPolicy);
    }

    private HttpClient httpClient(int connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(connectTimeoutMs, 1)))
                .build();
    }
}
