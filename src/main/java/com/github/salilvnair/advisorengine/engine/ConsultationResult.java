package com.github.salilvnair.advisorengine.engine;

import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.model.AdvisoryBrief;

/**
 * Brief plus how it was produced. Provider, model and raw response are null
 * when generation never answered.
 */
public record ConsultationResult(
        AdvisoryBrief brief,
        ConsultationOutcome outcome,
        String provider,
        String model,
        String rawResponse
) {

    public static ConsultationResult of(AdvisoryBrief brief, ConsultationOutcome outcome, GenerationOutcome generation) {
        if (generation == null) {
            return new ConsultationResult(brief, outcome, null, null, null);
        }
        return new ConsultationResult(brief, outcome, generation.provider(), generation.model(), generation.text());
    }

    public boolean isPolicyViolation() {
        return outcome == ConsultationOutcome.POLICY_VIOLATION;
    }

    public boolean isDegraded() {
        return outcome == ConsultationOutcome.DEGRADED;
    }
}
