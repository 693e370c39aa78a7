package com.github.salilvnair.advisorengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"title", "description", "pros", "cons", "sources"})
public record BriefOption(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("pros") List<String> pros,
        @JsonProperty("cons") List<String> cons,
        @JsonProperty("sources") List<String> sources
) {

    public BriefOption {
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
