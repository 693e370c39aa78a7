package com.github.salilvnair.advisorengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"canonical_id", "paraphrase", "relevance"})
public record SourceRef(
        @JsonProperty("canonical_id") String canonicalId,
        @JsonProperty("paraphrase") String paraphrase,
        @JsonProperty("relevance") double relevance
) {}
