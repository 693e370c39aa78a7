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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Anthropic Messages API adapter.
 */
@Slf4j
public class AnthropicGenerationProvider implements GenerationProvider {

    private static final String MESSAGES_PATH = "/v1/messages";

    private final AdvisorEngineLlmConfig.Anthropic config;
    private final HttpClient httpClient;

    public AnthropicGenerationProvider(AdvisorEngineLlmConfig.Anthropic config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    public String model() {
        return config.getModel();
    }

    @Override
    public GenerationOutcome generate(GenerationRequest request) {
        if (!isHealthy()) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.LLM_NOT_CONFIGURED, "Anthropic API key is not configured");
        }
        int maxTokens = request.maxTokens() == null ? config.getMaxTokens() : request.maxTokens();

        ObjectNode body = JsonUtil.object();
        body.put("model", config.getModel());
        body.put("max_tokens", maxTokens);
        body.put("temperature", request.temperature());
        body.put("system", request.systemPrompt() == null ? "" : request.systemPrompt());
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", request.prompt() == null ? "" : request.prompt());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(HttpExchange.join(config.getBaseUrl(), MESSAGES_PATH)))
                .timeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", config.getApiVersion())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(body)))
                .build();

        log.debug("Calling Anthropic {} with {} char prompt", config.getModel(), request.prompt() == null ? 0 : request.prompt().length());
        HttpResponse<String> response = HttpExchange.send(
                httpClient,
                httpRequest,
                "Anthropic",
                config.getRetry().getRetryStatusCodes(),
                AdvisorEngineErrorCode.LLM_CALL_FAILED,
                AdvisorEngineErrorCode.LLM_AUTH_FAILED);

        JsonNode root = JsonUtil.parseOrNull(response.body());
        String text = firstText(root.path("content"));
        if (text == null) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.LLM_INVALID_RESPONSE, "Anthropic response carried no text content");
        }
        int inputTokens = root.path("usage").path("input_tokens").asInt(0);
        int outputTokens = root.path("usage").path("output_tokens").asInt(0);
        log.info("Anthropic response: {} chars, {} in / {} out tokens", text.length(), inputTokens, outputTokens);
        return new GenerationOutcome(text, name(), config.getModel(), inputTokens, outputTokens);
    }

    /**
     * Configured means an API key is present; the remote side is not probed.
     */
    @Override
    public boolean isHealthy() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private String firstText(JsonNode content) {
        if (!content.isArray()) {
            return null;
        }
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text")) && block.path("text").isTextual()) {
                return block.path("text").asText();
            }
        }
        return null;
    }
}
