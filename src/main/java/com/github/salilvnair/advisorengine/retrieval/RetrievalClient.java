package com.github.salilvnair.advisorengine.retrieval;

import com.github.salilvnair.advisorengine.engine.exception.RetrievalUnavailableException;
import com.github.salilvnair.advisorengine.model.RetrievedPassage;
import com.github.salilvnair.advisorengine.resilience.CircuitBreaker;
import com.github.salilvnair.advisorengine.resilience.ResilientInvoker;
import com.github.salilvnair.advisorengine.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaker-protected similarity search. There is no fallback source: when the
 * breaker is open or retries run out the caller gets
 * {@link RetrievalUnavailableException} and decides how to degrade.
 */
@Slf4j
public class RetrievalClient {

    private final VectorSearchService searchService;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final ResilientInvoker invoker;
    private final int defaultTopK;

    public RetrievalClient(
            VectorSearchService searchService,
            CircuitBreaker breaker,
            RetryPolicy retryPolicy,
            ResilientInvoker invoker,
            int defaultTopK
    ) {
        this.searchService = searchService;
        this.breaker = breaker;
        this.retryPolicy = retryPolicy;
        this.invoker = invoker == null ? new ResilientInvoker() : invoker;
        this.defaultTopK = Math.max(defaultTopK, 1);
    }

    public List<RetrievedPassage> search(String query) {
        return search(query, defaultTopK);
    }

    public List<RetrievedPassage> search(String query, int topK) {
        int k = topK <= 0 ? defaultTopK : topK;
        log.info("Retrieving top {} passages for query", k);
        VectorSearchResult result;
        try {
            result = invoker.call(breaker, retryPolicy, () -> searchService.search(query, k));
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException("Vector search unavailable: " + e.getMessage(), e);
        }
        List<RetrievedPassage> passages = toPassages(result);
        log.debug("Retrieved passages: {}", passages.stream().map(RetrievedPassage::canonicalId).toList());
        return passages;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    List<RetrievedPassage> toPassages(VectorSearchResult result) {
        if (result == null) {
            return List.of();
        }
        int size = result.alignedSize();
        if (!result.isAligned()) {
            log.warn("Vector search arrays are misaligned (ids={}, distances={}, documents={}, metadatas={}), truncating to {}",
                    result.ids().size(), result.distances().size(), result.documents().size(),
                    result.metadatas().size(), size);
        }
        List<RetrievedPassage> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Double distance = result.distances().get(i);
            out.add(RetrievedPassage.fromDistance(
                    result.ids().get(i),
                    result.documents().get(i),
                    distance == null ? 1.0d : distance,
                    result.metadatas().get(i)));
        }
        return out;
    }
}
