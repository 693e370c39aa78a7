package com.github.salilvnair.advisorengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * The structured brief handed to callers. Field names on the wire are
 * snake_case; {@code policy_violation} only appears when true and
 * {@code warnings} only when non-empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "suggested_title",
        "executive_summary",
        "options",
        "recommended_action",
        "reflection_prompts",
        "sources",
        "confidence",
        "scholar_flag",
        "policy_violation",
        "warnings"
})
public record AdvisoryBrief(
        @JsonProperty("suggested_title") String suggestedTitle,
        @JsonProperty("executive_summary") String executiveSummary,
        @JsonProperty("options") List<BriefOption> options,
        @JsonProperty("recommended_action") RecommendedAction recommendedAction,
        @JsonProperty("reflection_prompts") List<String> reflectionPrompts,
        @JsonProperty("sources") List<SourceRef> sources,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("scholar_flag") boolean scholarFlag,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        @JsonProperty("policy_violation") boolean policyViolation,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("warnings") List<String> warnings
) {

    public AdvisoryBrief {
        options = options == null ? List.of() : List.copyOf(options);
        reflectionPrompts = reflectionPrompts == null ? List.of() : List.copyOf(reflectionPrompts);
        sources = sources == null ? List.of() : List.copyOf(sources);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public AdvisoryBrief withConfidence(double newConfidence, boolean newScholarFlag) {
        return new AdvisoryBrief(suggestedTitle, executiveSummary, options, recommendedAction,
                reflectionPrompts, sources, newConfidence, newScholarFlag, policyViolation, warnings);
    }

    public AdvisoryBrief withWarning(String warning) {
        if (warning == null || warnings.contains(warning)) {
            return this;
        }
        List<String> next = new ArrayList<>(warnings);
        next.add(warning);
        return new AdvisoryBrief(suggestedTitle, executiveSummary, options, recommendedAction,
                reflectionPrompts, sources, confidence, scholarFlag, policyViolation, next);
    }
}
