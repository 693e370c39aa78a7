package com.github.salilvnair.advisorengine.extract;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.advisorengine.engine.exception.ResponseExtractionException;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first JSON object in untrusted model output.
 * <ol>
 *   <li>the whole text as one value</li>
 *   <li>fenced code blocks, language-tagged first, then generic</li>
 *   <li>a single value decoded from each opening brace in turn</li>
 * </ol>
 * Arrays, strings and other non-object values are rejected at every step.
 */
@Slf4j
@Component
public class ResponseExtractor {

    private static final List<Pattern> FENCE_PATTERNS = List.of(
            Pattern.compile("```(?:json)?\\s*\\n(.*?)\\n```", Pattern.DOTALL),
            Pattern.compile("```(.*?)```", Pattern.DOTALL));

    private static final int LOG_SNIPPET = 500;

    private final ObjectMapper mapper = JsonUtil.mapper();

    public ObjectNode extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new ResponseExtractionException("Empty LLM response");
        }

        Optional<ObjectNode> direct = parseObject(rawText);
        if (direct.isPresent()) {
            return direct.get();
        }

        for (Pattern pattern : FENCE_PATTERNS) {
            Matcher matcher = pattern.matcher(rawText);
            while (matcher.find()) {
                Optional<ObjectNode> fenced = parseObject(matcher.group(1).strip());
                if (fenced.isPresent()) {
                    return fenced.get();
                }
            }
        }

        for (int start = rawText.indexOf('{'); start >= 0; start = rawText.indexOf('{', start + 1)) {
            Optional<ObjectNode> embedded = decodeAt(rawText, start);
            if (embedded.isPresent()) {
                log.debug("Extracted JSON from position {}", start);
                return embedded.get();
            }
        }

        log.error("Could not extract JSON from response. First {} chars: {}", LOG_SNIPPET, JsonUtil.truncate(rawText, LOG_SNIPPET));
        throw new ResponseExtractionException("No valid JSON found in LLM response");
    }

    public Optional<ObjectNode> tryExtract(String rawText) {
        try {
            return Optional.of(extract(rawText));
        } catch (ResponseExtractionException e) {
            return Optional.empty();
        }
    }

    private Optional<ObjectNode> parseObject(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            if (node instanceof ObjectNode object) {
                return Optional.of(object);
            }
            log.debug("Parse returned {}, expected object", node == null ? "nothing" : node.getNodeType());
        } catch (JsonProcessingException e) {
            log.debug("Parse failed at {}: {}", e.getLocation(), e.getOriginalMessage());
        }
        return Optional.empty();
    }

    // one balanced value from offset, trailing text ignored
    private Optional<ObjectNode> decodeAt(String text, int offset) {
        try (JsonParser parser = mapper.getFactory().createParser(text.substring(offset))) {
            JsonNode node = mapper.readTree(parser);
            if (node instanceof ObjectNode object) {
                return Optional.of(object);
            }
        } catch (IOException e) {
            log.trace("No object at offset {}: {}", offset, e.getMessage());
        }
        return Optional.empty();
    }
}
