package com.github.salilvnair.advisorengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * @param option 1-based index into {@link AdvisoryBrief#options()}
 */
@JsonPropertyOrder({"option", "steps", "sources"})
public record RecommendedAction(
        @JsonProperty("option") int option,
        @JsonProperty("steps") List<String> steps,
        @JsonProperty("sources") List<String> sources
) {

    public RecommendedAction {
        steps = steps == null ? List.of() : List.copyOf(steps);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
