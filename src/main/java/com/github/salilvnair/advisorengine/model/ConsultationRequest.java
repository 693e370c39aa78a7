package com.github.salilvnair.advisorengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The dilemma a caller wants advice on. Only {@code title} and
 * {@code description} are expected; everything else may be absent.
 */
public record ConsultationRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("role") String role,
        @JsonProperty("stakeholders") List<String> stakeholders,
        @JsonProperty("constraints") List<String> constraints,
        @JsonProperty("horizon") String horizon,
        @JsonProperty("sensitivity") String sensitivity
) {

    public static final String DEFAULT_SENSITIVITY = "low";

    public ConsultationRequest {
        stakeholders = stakeholders == null ? List.of() : stakeholders.stream().filter(s -> s != null && !s.isBlank()).toList();
        constraints = constraints == null ? List.of() : constraints.stream().filter(c -> c != null && !c.isBlank()).toList();
        sensitivity = sensitivity == null || sensitivity.isBlank() ? DEFAULT_SENSITIVITY : sensitivity;
    }

    public static ConsultationRequest of(String title, String description) {
        return new ConsultationRequest(title, description, null, List.of(), List.of(), null, null);
    }
}
