package com.github.salilvnair.advisorengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RetrievedPassage(
        String canonicalId,
        String text,
        double relevance,
        Map<String, Object> metadata
) {

    public static final String META_PARAPHRASE = "paraphrase";
    public static final String META_TRANSLATION = "translation_en";
    public static final String META_PRINCIPLES = "principles";
    public static final String META_TRANSLATIONS = "translations";

    public RetrievedPassage {
        relevance = Double.isNaN(relevance) ? 0.0d : Math.max(0.0d, Math.min(1.0d, relevance));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RetrievedPassage fromDistance(String canonicalId, String text, double distance, Map<String, Object> metadata) {
        return new RetrievedPassage(canonicalId, text, 1.0d - distance, metadata);
    }

    public String metadataText(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }
}
