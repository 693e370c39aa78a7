package com.github.salilvnair.advisorengine.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.advisorengine.support.TestConstants.CASE_DESCRIPTION;
import static com.github.salilvnair.advisorengine.support.TestConstants.LEADERSHIP_DESCRIPTION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OfflineStubGenerationProviderTest {

    private final OfflineStubGenerationProvider provider = new OfflineStubGenerationProvider();

    @Test
    void samePromptAlwaysYieldsSameText() {
        GenerationOutcome first = provider.generate(GenerationRequest.of(CASE_DESCRIPTION, null));
        GenerationOutcome second = provider.generate(GenerationRequest.of(CASE_DESCRIPTION, null));

        assertEquals(first.text(), second.text());
        assertEquals(OfflineStubGenerationProvider.MODEL, first.model());
        assertEquals("stub", first.provider());
    }

    @Test
    void leadershipKeywordsSelectLeadershipTemplate() {
        JsonNode leadership = JsonUtil.parseOrNull(provider.generate(GenerationRequest.of(LEADERSHIP_DESCRIPTION, null)).text());
        JsonNode general = JsonUtil.parseOrNull(provider.generate(GenerationRequest.of(CASE_DESCRIPTION, null)).text());

        assertNotEquals(leadership.path("executive_summary").asText(), general.path("executive_summary").asText());
        assertEquals(3, leadership.path("options").size());
        assertEquals(3, general.path("options").size());
    }

    @Test
    void confidenceStaysInAdjustedRange() {
        JsonNode brief = JsonUtil.parseOrNull(provider.generate(GenerationRequest.of(CASE_DESCRIPTION, null)).text());
        double confidence = brief.path("confidence").asDouble();

        assertTrue(confidence >= 0.85 && confidence <= 0.94, "confidence was " + confidence);
    }

    @Test
    void adjustmentIsAHundredthStep() {
        double adjustment = OfflineStubGenerationProvider.confidenceAdjustment(CASE_DESCRIPTION);

        assertTrue(adjustment >= 0.0 && adjustment <= 0.09);
        assertEquals(adjustment, OfflineStubGenerationProvider.confidenceAdjustment(CASE_DESCRIPTION));
    }
}
