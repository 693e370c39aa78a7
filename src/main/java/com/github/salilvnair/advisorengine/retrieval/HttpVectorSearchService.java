package com.github.salilvnair.advisorengine.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.advisorengine.config.AdvisorEngineRetrievalConfig;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POSTs {@code {query, top_k, collection}} to the configured endpoint and
 * reads back {@code {ids, distances, documents, metadatas}}. Nested
 * single-query arrays ({@code [[...]]}) are unwrapped.
 */
@Slf4j
public class HttpVectorSearchService implements VectorSearchService {

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final AdvisorEngineRetrievalConfig config;
    private final HttpClient httpClient;

    public HttpVectorSearchService(AdvisorEngineRetrievalConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public VectorSearchResult search(String query, int topK) {
        ObjectNode body = JsonUtil.object();
        body.put("query", query == null ? "" : query);
        body.put("top_k", topK);
        body.put("collection", config.getCollection());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getEndpointUrl()))
                .timeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(body)))
                .build();

        HttpResponse<String> response = HttpExchange.send(
                httpClient,
                request,
                "Vector search",
                config.getRetry().getRetryStatusCodes(),
                AdvisorEngineErrorCode.RETRIEVAL_FAILED,
                AdvisorEngineErrorCode.RETRIEVAL_FAILED);

        JsonNode root = JsonUtil.parseOrNull(response.body());
        if (!root.isObject()) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.RETRIEVAL_FAILED, "Vector search returned a non-object body");
        }
        return new VectorSearchResult(
                texts(unwrap(root.path("ids"))),
                numbers(unwrap(root.path("distances"))),
                texts(unwrap(root.path("documents"))),
                objects(unwrap(root.path("metadatas"))));
    }

    private JsonNode unwrap(JsonNode node) {
        if (node.isArray() && node.size() == 1 && node.get(0).isArray()) {
            return node.get(0);
        }
        return node;
    }

    private List<String> texts(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> out.add(item.isNull() ? "" : item.asText()));
        }
        return out;
    }

    private List<Double> numbers(JsonNode node) {
        List<Double> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> out.add(item.isNumber() ? item.asDouble() : 1.0d));
        }
        return out;
    }

    private List<Map<String, Object>> objects(JsonNode node) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    out.add(JsonUtil.mapper().convertValue(item, METADATA_TYPE));
                } else {
                    out.add(Map.of());
                }
            }
        }
        return out;
    }
}
