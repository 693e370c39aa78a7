package com.github.salilvnair.advisorengine.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.advisorengine.config.AdvisorEngineLlmConfig;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.llm.core.GenerationProvider;
import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;
import com.github.salilvnair.advisorengine.llm.model.ProviderKind;
import com.github.salilvnair.advisorengine.util.HttpExchange;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Local Ollama adapter. Always requests JSON output mode with the provider's
 * own low temperature.
 */
@Slf4j
public class OllamaGenerationProvider implements GenerationProvider {

    private static final String GENERATE_PATH = "/api/generate";
    private static final String TAGS_PATH = "/api/tags";
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    private final AdvisorEngineLlmConfig.Ollama config;
    private final HttpClient httpClient;

    public OllamaGenerationProvider(AdvisorEngineLlmConfig.Ollama config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OLLAMA;
    }

    @Override
    public String model() {
        return config.getModel();
    }

    @Override
    public GenerationOutcome generate(GenerationRequest request) {
        if (!config.isEnabled()) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.LLM_NOT_CONFIGURED, "Ollama is not enabled");
        }
        int maxTokens = request.maxTokens() == null ? config.getMaxTokens() : request.maxTokens();

        ObjectNode payload = JsonUtil.object();
        payload.put("model", config.getModel());
        payload.put("prompt", request.prompt() == null ? "" : request.prompt());
        payload.put("stream", false);
        payload.put("format", "json");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            payload.put("system", request.systemPrompt());
        }
        ObjectNode options = payload.putObject("options");
        options.put("temperature", config.getTemperature());
        options.put("num_predict", maxTokens);

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(HttpExchange.join(config.getBaseUrl(), GENERATE_PATH)))
                .timeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(payload)))
                .build();

        log.debug("Calling Ollama ({}) with {} char prompt", config.getModel(), request.prompt() == null ? 0 : request.prompt().length());
        HttpResponse<String> response = HttpExchange.send(
                httpClient,
                httpRequest,
                "Ollama",
                config.getRetry().getRetryStatusCodes(),
                AdvisorEngineErrorCode.LLM_CALL_FAILED,
                AdvisorEngineErrorCode.LLM_AUTH_FAILED);

        JsonNode root = JsonUtil.parseOrNull(response.body());
        if (!root.isObject() || !root.path("response").isTextual()) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.LLM_INVALID_RESPONSE, "Ollama response carried no text");
        }
        String text = root.path("response").asText();
        String model = root.path("model").asText(config.getModel());
        log.info("Ollama response: {} chars", text.length());
        return new GenerationOutcome(
                text,
                name(),
                model,
                root.path("prompt_eval_count").asInt(0),
                root.path("eval_count").asInt(0));
    }

    @Override
    public boolean isHealthy() {
        if (!config.isEnabled()) {
            return false;
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(HttpExchange.join(config.getBaseUrl(), TAGS_PATH)))
                .timeout(HEALTH_TIMEOUT)
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode() == 200;
        } catch (IOException e) {
            log.error("Ollama health check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Ollama health check interrupted");
            return false;
        }
    }
}
