package com.github.salilvnair.advisorengine.prompt;

import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.model.ConsultationRequest;
import com.github.salilvnair.advisorengine.model.RetrievedPassage;
import com.github.salilvnair.advisorengine.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a request and its retrieved passages into the full and condensed
 * prompt pairs. Output depends only on the inputs and configuration.
 */
@Slf4j
@Component
public class PromptBuilder {

    private static final String NOT_AVAILABLE = "N/A";
    private static final String DEFAULT_AUDIENCE = "leader";
    private static final int EXTRA_TRANSLATIONS = 2;

    private final ThymeleafTemplateRenderer renderer;
    private final AdvisorEngineRagConfig ragConfig;
    private final String systemPrompt;
    private final String fewShotExample;
    private final String condensedSystemPrompt;
    private final String userTemplate;
    private final String condensedUserTemplate;

    public PromptBuilder(ThymeleafTemplateRenderer renderer, AdvisorEngineRagConfig ragConfig) {
        this.renderer = renderer;
        this.ragConfig = ragConfig;
        this.systemPrompt = load(PromptTemplates.SYSTEM);
        this.fewShotExample = load(PromptTemplates.FEW_SHOT);
        this.condensedSystemPrompt = load(PromptTemplates.CONDENSED_SYSTEM);
        this.userTemplate = load(PromptTemplates.USER);
        this.condensedUserTemplate = load(PromptTemplates.CONDENSED_USER);
    }

    public PromptBundle build(ConsultationRequest request, List<RetrievedPassage> passages) {
        List<RetrievedPassage> safePassages = passages == null ? List.of() : passages;
        List<RetrievedPassage> fullPassages = limit(safePassages, ragConfig.getPromptPassageLimit());
        List<RetrievedPassage> condensedPassages = limit(safePassages, ragConfig.getCondensedPassageCount());

        String prompt;
        String fallbackPrompt;
        try {
            prompt = renderer.render(userTemplate, fullVariables(request, fullPassages));
            fallbackPrompt = renderer.render(condensedUserTemplate, condensedVariables(request, condensedPassages));
        } catch (RuntimeException e) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.PROMPT_RENDER_FAILED,
                    "Failed to render consultation prompt: " + e.getMessage(), e);
        }

        String system = systemPrompt;
        String fallbackSystem = condensedSystemPrompt;
        if (ragConfig.isUseFewShots()) {
            system = systemPrompt + "\n\n" + fewShotExample;
            fallbackSystem = condensedSystemPrompt + "\n\n" + fewShotExample;
            log.debug("Few-shot example included in system prompts");
        }
        log.debug("Prompt length: {} chars, condensed: {} chars", prompt.length(), fallbackPrompt.length());
        return new PromptBundle(prompt, system, fallbackPrompt, fallbackSystem);
    }

    /**
     * Stable key for an upstream cache: SHA-256 over the request's canonical JSON.
     */
    public String cacheKey(ConsultationRequest request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(JsonUtil.toJson(request).getBytes(StandardCharsets.UTF_8));
            return "consultation:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Map<String, Object> fullVariables(ConsultationRequest request, List<RetrievedPassage> passages) {
        Map<String, Object> vars = caseVariables(request);
        vars.put("horizon", orNa(request.horizon()));
        vars.put("sensitivity", request.sensitivity());
        vars.put("hasStakeholders", !request.stakeholders().isEmpty());
        vars.put("stakeholders", String.join(", ", request.stakeholders()));
        vars.put("hasConstraints", !request.constraints().isEmpty());
        vars.put("constraints", request.constraints());
        vars.put("audience", request.role() == null || request.role().isBlank() ? DEFAULT_AUDIENCE : request.role());
        vars.put("passageCount", passages.size());
        vars.put("passages", passageVariables(passages, true));
        return vars;
    }

    private Map<String, Object> condensedVariables(ConsultationRequest request, List<RetrievedPassage> passages) {
        Map<String, Object> vars = caseVariables(request);
        vars.put("passages", passageVariables(passages, false));
        return vars;
    }

    private Map<String, Object> caseVariables(ConsultationRequest request) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("title", orNa(request.title()));
        vars.put("role", orNa(request.role()));
        vars.put("description", orNa(request.description()));
        return vars;
    }

    // every key is always present; missing values are null
    private List<Map<String, Object>> passageVariables(List<RetrievedPassage> passages, boolean full) {
        List<Map<String, Object>> out = new ArrayList<>();
        int index = 1;
        for (RetrievedPassage passage : passages) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("index", index++);
            item.put("canonicalId", passage.canonicalId() == null ? "Unknown" : passage.canonicalId());
            item.put("paraphrase", orNa(passage.metadataText(RetrievedPassage.META_PARAPHRASE)));
            item.put("translation", passage.metadataText(RetrievedPassage.META_TRANSLATION));
            item.put("principles", full ? principles(passage.metadata().get(RetrievedPassage.META_PRINCIPLES)) : null);
            item.put("translations", full ? extraTranslations(passage.metadata().get(RetrievedPassage.META_TRANSLATIONS)) : List.of());
            out.add(item);
        }
        return out;
    }

    private String principles(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            List<String> parts = list.stream().filter(p -> p != null).map(String::valueOf).toList();
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    private List<Map<String, Object>> extraTranslations(Object value) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            return out;
        }
        for (Object entry : list) {
            if (out.size() >= EXTRA_TRANSLATIONS) {
                break;
            }
            if (entry instanceof Map<?, ?> map) {
                Object text = map.get("text");
                if (text == null || String.valueOf(text).isBlank()) {
                    continue;
                }
                Object translator = map.get("translator");
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("translator", translator == null ? "Unknown" : String.valueOf(translator));
                item.put("text", String.valueOf(text));
                out.add(item);
            }
        }
        return out;
    }

    private static List<RetrievedPassage> limit(List<RetrievedPassage> passages, int max) {
        return passages.size() <= max ? passages : passages.subList(0, Math.max(max, 0));
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }

    private static String load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new AdvisorEngineException(AdvisorEngineErrorCode.PROMPT_TEMPLATE_MISSING,
                    "Prompt template could not be loaded: " + path, e);
        }
    }
}
