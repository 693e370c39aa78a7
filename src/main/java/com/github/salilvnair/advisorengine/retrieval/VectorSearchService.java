package com.github.salilvnair.advisorengine.retrieval;

/**
 * Boundary to the external vector-similarity store. A single attempt per call.
 */
public interface VectorSearchService {

    VectorSearchResult search(String query, int topK);
}
