package com.github.salilvnair.advisorengine.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Raw similarity-search answer, aligned index-for-index across the four lists.
 */
public record VectorSearchResult(
        List<String> ids,
        List<Double> distances,
        List<String> documents,
        List<Map<String, Object>> metadatas
) {

    public VectorSearchResult {
        ids = ids == null ? List.of() : ids;
        distances = distances == null ? List.of() : distances;
        documents = documents == null ? List.of() : documents;
        metadatas = metadatas == null ? List.of() : metadatas;
    }

    public static VectorSearchResult empty() {
        return new VectorSearchResult(List.of(), List.of(), List.of(), List.of());
    }

    public boolean isAligned() {
        int size = ids.size();
        return distances.size() == size && documents.size() == size && metadatas.size() == size;
    }

    public int alignedSize() {
        return Math.min(Math.min(ids.size(), distances.size()), Math.min(documents.size(), metadatas.size()));
    }
}
