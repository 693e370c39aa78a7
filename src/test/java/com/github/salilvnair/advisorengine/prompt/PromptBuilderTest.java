package com.github.salilvnair.advisorengine.prompt;

import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import com.github.salilvnair.advisorengine.llm.model.GenerationRequest;
import com.github.salilvnair.advisorengine.model.ConsultationRequest;
import com.github.salilvnair.advisorengine.model.RetrievedPassage;
import com.github.salilvnair.advisorengine.template.ThymeleafTemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.advisorengine.support.TestConstants.CASE_DESCRIPTION;
import static com.github.salilvnair.advisorengine.support.TestConstants.CASE_ROLE;
import static com.github.salilvnair.advisorengine.support.TestConstants.CASE_TITLE;
import static com.github.salilvnair.advisorengine.support.TestConstants.ID_2_47;
import static com.github.salilvnair.advisorengine.support.TestConstants.ID_3_19;
import static com.github.salilvnair.advisorengine.support.TestConstants.PARAPHRASE_2_47;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptBuilderTest {

    private AdvisorEngineRagConfig ragConfig;
    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        ragConfig = new AdvisorEngineRagConfig();
        builder = new PromptBuilder(new ThymeleafTemplateRenderer(), ragConfig);
    }

    @Test
    void fullPromptCarriesCaseAndPassages() {
        ConsultationRequest request = new ConsultationRequest(CASE_TITLE, CASE_DESCRIPTION, CASE_ROLE,
                List.of("team", "auditors"), List.of("quarter-end deadline"), "short", "high");
        List<RetrievedPassage> passages = List.of(
                new RetrievedPassage(ID_2_47, "text", 0.9, Map.of(
                        RetrievedPassage.META_PARAPHRASE, PARAPHRASE_2_47,
                        RetrievedPassage.META_TRANSLATION, "You have a right to action alone.",
                        RetrievedPassage.META_PRINCIPLES, List.of("duty", "detachment"),
                        RetrievedPassage.META_TRANSLATIONS, List.of(
                                Map.of("translator", "Gandhi", "text", "Thy business is with the action only."),
                                Map.of("translator", "Arnold", "text", "Let right deeds be thy motive."),
                                Map.of("translator", "Third", "text", "Not shown.")))),
                new RetrievedPassage(ID_3_19, "text", 0.7, Map.of()));

        PromptBundle bundle = builder.build(request, passages);
        String prompt = bundle.prompt();

        assertTrue(prompt.contains("**Title:** " + CASE_TITLE));
        assertTrue(prompt.contains("**Sensitivity:** high"));
        assertTrue(prompt.contains("**Stakeholders:** team, auditors"));
        assertTrue(prompt.contains("- quarter-end deadline"));
        assertTrue(prompt.contains("**Verse 1: " + ID_2_47 + "**"));
        assertTrue(prompt.contains("Paraphrase: " + PARAPHRASE_2_47));
        assertTrue(prompt.contains("Translation: You have a right to action alone."));
        assertTrue(prompt.contains("Gandhi: Thy business is with the action only."));
        assertFalse(prompt.contains("Not shown."));
        assertTrue(prompt.contains("Principles: duty, detachment"));
        assertTrue(prompt.contains("**Verse 2: " + ID_3_19 + "**"));
        assertTrue(prompt.contains("Paraphrase: N/A"));
        assertTrue(prompt.contains("consulting brief for a " + CASE_ROLE));
        assertTrue(prompt.contains("Use up to 2 Geeta verses"));
    }

    @Test
    void missingOptionalFieldsFallBackToDefaults() {
        PromptBundle bundle = builder.build(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION), List.of());

        assertTrue(bundle.prompt().contains("**Role:** N/A"));
        assertTrue(bundle.prompt().contains("**Sensitivity:** low"));
        assertFalse(bundle.prompt().contains("**Stakeholders:**"));
        assertFalse(bundle.prompt().contains("**Constraints:**"));
        assertTrue(bundle.prompt().contains("consulting brief for a leader"));
        assertTrue(bundle.prompt().contains("Use up to 0 Geeta verses"));
    }

    @Test
    void condensedPromptKeepsOnlyTopPassages() {
        List<RetrievedPassage> passages = new ArrayList<>();
        for (int verse = 1; verse <= 5; verse++) {
            passages.add(new RetrievedPassage("BG_2_" + verse, "text", 0.5, Map.of()));
        }

        PromptBundle bundle = builder.build(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION), passages);

        assertTrue(bundle.fallbackPrompt().contains("3. BG_2_3"));
        assertFalse(bundle.fallbackPrompt().contains("BG_2_4"));
        assertTrue(bundle.prompt().contains("**Verse 5: BG_2_5**"));
        assertTrue(bundle.fallbackPrompt().length() < bundle.prompt().length());
    }

    @Test
    void fewShotExampleIsAppendedOnlyWhenEnabled() {
        PromptBundle plain = builder.build(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION), List.of());
        assertFalse(plain.systemPrompt().contains("# Example Case"));

        ragConfig.setUseFewShots(true);
        PromptBundle withExample = builder.build(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION), List.of());

        assertTrue(withExample.systemPrompt().startsWith(plain.systemPrompt() + "\n\n"));
        assertTrue(withExample.systemPrompt().contains("# Example Case"));
        assertTrue(withExample.fallbackSystemPrompt().contains("# Example Case"));
    }

    @Test
    void bundleBecomesRequestWithFallbackPair() {
        PromptBundle bundle = builder.build(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION), List.of());

        GenerationRequest request = bundle.toRequest(0.7);

        assertEquals(bundle.prompt(), request.prompt());
        assertEquals(bundle.fallbackPrompt(), request.forFallback().prompt());
        assertEquals(bundle.fallbackSystemPrompt(), request.forFallback().systemPrompt());
    }

    @Test
    void cacheKeyIsStablePerRequest() {
        String first = builder.cacheKey(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION));
        String second = builder.cacheKey(ConsultationRequest.of(CASE_TITLE, CASE_DESCRIPTION));
        String other = builder.cacheKey(ConsultationRequest.of(CASE_TITLE, "something else"));

        assertEquals(first, second);
        assertNotEquals(first, other);
        assertTrue(first.matches("consultation:[0-9a-f]{64}"));
    }
}
