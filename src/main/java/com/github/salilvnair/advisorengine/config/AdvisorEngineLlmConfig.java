package com.github.salilvnair.advisorengine.config;

import com.github.salilvnair.advisorengine.llm.model.ProviderKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "advisorengine.llm")
@Getter
@Setter
public class AdvisorEngineLlmConfig {

    /**
     * Offline deterministic stub. Overrides every provider setting below.
     */
    private boolean stubEnabled = false;
    private ProviderKind primary = ProviderKind.ANTHROPIC;
    private boolean fallbackEnabled = true;
    /**
     * Secondary providers, tried in order with the condensed prompt.
     */
    private List<ProviderKind> fallbacks = new ArrayList<>(List.of(ProviderKind.OLLAMA));
    private double temperature = 0.7d;
    private Anthropic anthropic = new Anthropic();
    private Ollama ollama = new Ollama();

    @Getter
    @Setter
    public static class Anthropic {
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com";
        private String apiVersion = "2023-06-01";
        private String model = "claude-3-5-haiku-latest";
        private int maxTokens = 2048;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;
        private ResilienceProperties.Retry retry = defaultRetry(2, 1000L, 8000L);
        private ResilienceProperties.Circuit circuit = new ResilienceProperties.Circuit();
    }

    @Getter
    @Setter
    public static class Ollama {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:11434";
        private String model = "qwen2.5:3b";
        private int maxTokens = 1024;
        /**
         * Lower than the primary temperature to keep local JSON output stable.
         */
        private double temperature = 0.3d;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 300000;
        private ResilienceProperties.Retry retry = defaultRetry(2, 1000L, 10000L);
        private ResilienceProperties.Circuit circuit = new ResilienceProperties.Circuit();
    }

    private static ResilienceProperties.Retry defaultRetry(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        ResilienceProperties.Retry retry = new ResilienceProperties.Retry();
        retry.setMaxAttempts(maxAttempts);
        retry.setInitialBackoffMs(initialBackoffMs);
        retry.setMaxBackoffMs(maxBackoffMs);
        return retry;
    }
}
