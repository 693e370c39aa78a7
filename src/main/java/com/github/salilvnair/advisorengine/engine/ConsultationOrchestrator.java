package com.github.salilvnair.advisorengine.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.advisorengine.config.AdvisorEngineLlmConfig;
import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import com.github.salilvnair.advisorengine.config.AdvisorEngineRetrievalConfig;
import com.github.salilvnair.advisorengine.engine.constants.WarningCodes;
import com.github.salilvnair.advisorengine.engine.core.ConsultationEngine;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.engine.exception.ResponseExtractionException;
import com.github.salilvnair.advisorengine.engine.exception.RetrievalUnavailableException;
import com.github.salilvnair.advisorengine.extract.ResponseExtractor;
import com.github.salilvnair.advisorengine.llm.core.GenerationClient;
import com.github.salilvnair.advisorengine.llm.model.GenerationOutcome;
import com.github.salilvnair.advisorengine.model.AdvisoryBrief;
import com.github.salilvnair.advisorengine.model.ConsultationRequest;
import com.github.salilvnair.advisorengine.model.RetrievedPassage;
import com.github.salilvnair.advisorengine.prompt.PromptBuilder;
import com.github.salilvnair.advisorengine.prompt.PromptBundle;
import com.github.salilvnair.advisorengine.refusal.RefusalDetector;
import com.github.salilvnair.advisorengine.refusal.RefusalVerdict;
import com.github.salilvnair.advisorengine.retrieval.RetrievalClient;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import com.github.salilvnair.advisorengine.validate.AdvisoryBriefValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one consultation end to end. Every failure below this point turns
 * into a usable brief; callers only ever see a {@link ConsultationResult}.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ConsultationOrchestrator implements ConsultationEngine {

    private final RetrievalClient retrievalClient;
    private final PromptBuilder promptBuilder;
    private final GenerationClient generationClient;
    private final RefusalDetector refusalDetector;
    private final ResponseExtractor responseExtractor;
    private final AdvisoryBriefValidator validator;
    private final AdvisorEngineLlmConfig llmConfig;
    private final AdvisorEngineRetrievalConfig retrievalConfig;
    private final AdvisorEngineRagConfig ragConfig;

    @Override
    public ConsultationResult run(ConsultationRequest request) {
        log.info("Starting consultation '{}'", request.title());

        // ------------------------------------------------------------
        // 1. Retrieval (degrades to no passages)
        // ------------------------------------------------------------
        List<RetrievedPassage> passages = retrieve(request);

        // ------------------------------------------------------------
        // 2. Prompt
        // ------------------------------------------------------------
        PromptBundle bundle;
        try {
            bundle = promptBuilder.build(request, passages);
        } catch (AdvisorEngineException e) {
            log.error("Prompt construction failed: {}", e.getMessage());
            return ConsultationResult.of(FixedBriefs.fallback(), ConsultationOutcome.DEGRADED, null);
        }

        // ------------------------------------------------------------
        // 3. Generation
        // ------------------------------------------------------------
        GenerationOutcome generation;
        try {
            generation = generationClient.generate(bundle.toRequest(llmConfig.getTemperature()));
        } catch (AdvisorEngineException e) {
            log.error("Generation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return ConsultationResult.of(FixedBriefs.fallback(), ConsultationOutcome.DEGRADED, null);
        }

        // ------------------------------------------------------------
        // 4. Refusal check (before any parsing)
        // ------------------------------------------------------------
        RefusalVerdict verdict = refusalDetector.detect(generation.text());
        if (verdict.refusal()) {
            log.warn("Model refused the consultation (provider={}, matched='{}')",
                    generation.provider(), verdict.matchedPattern());
            return ConsultationResult.of(FixedBriefs.policyViolation(), ConsultationOutcome.POLICY_VIOLATION, generation);
        }

        // ------------------------------------------------------------
        // 5. Extraction (salvage on failure)
        // ------------------------------------------------------------
        ConsultationOutcome outcome = ConsultationOutcome.NOMINAL;
        ObjectNode raw;
        try {
            raw = responseExtractor.extract(generation.text());
        } catch (ResponseExtractionException e) {
            log.warn("Salvaging unparseable response from {}: {}", generation.provider(), e.getMessage());
            raw = JsonUtil.object();
            outcome = ConsultationOutcome.DEGRADED;
        }

        // ------------------------------------------------------------
        // 6. Validation and repair
        // ------------------------------------------------------------
        AdvisoryBrief brief = validator.validate(raw, passages);

        // ------------------------------------------------------------
        // 7. No grounding at all
        // ------------------------------------------------------------
        if (passages.isEmpty()) {
            double capped = Math.min(brief.confidence(), ragConfig.getDegradedConfidenceCap());
            brief = brief.withConfidence(capped, true).withWarning(WarningCodes.RETRIEVAL_DEGRADED);
            outcome = ConsultationOutcome.DEGRADED;
        }

        log.info("Consultation finished: outcome={}, provider={}, confidence={}, review={}",
                outcome, generation.provider(), brief.confidence(), brief.scholarFlag());
        return ConsultationResult.of(brief, outcome, generation);
    }

    private List<RetrievedPassage> retrieve(ConsultationRequest request) {
        if (!retrievalConfig.isEnabled()) {
            log.warn("Retrieval disabled, continuing without passages");
            return List.of();
        }
        try {
            List<RetrievedPassage> passages = retrievalClient.search(request.description());
            if (passages.isEmpty()) {
                log.warn("No passages retrieved, continuing with empty context");
            }
            return passages;
        } catch (RetrievalUnavailableException e) {
            log.error("Retrieval failed, continuing without passages: {}", e.getMessage());
            return List.of();
        }
    }
}
