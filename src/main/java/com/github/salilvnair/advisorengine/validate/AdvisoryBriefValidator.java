package com.github.salilvnair.advisorengine.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import com.github.salilvnair.advisorengine.model.AdvisoryBrief;
import com.github.salilvnair.advisorengine.model.BriefOption;
import com.github.salilvnair.advisorengine.model.RecommendedAction;
import com.github.salilvnair.advisorengine.model.RetrievedPassage;
import com.github.salilvnair.advisorengine.model.SourceRef;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.CANONICAL_ID;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.CONFIDENCE;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.CONS;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.DESCRIPTION;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.EXECUTIVE_SUMMARY;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.OPTION;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.OPTIONS;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.PARAPHRASE;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.POLICY_VIOLATION;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.PROS;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.RECOMMENDED_ACTION;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.REFLECTION_PROMPTS;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.RELEVANCE;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.SCHOLAR_FLAG;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.SOURCES;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.STEPS;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.SUGGESTED_TITLE;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.TITLE;
import static com.github.salilvnair.advisorengine.engine.constants.BriefFields.WARNINGS;

/**
 * Repairs an untrusted, extracted object into a well-formed {@link AdvisoryBrief}.
 * <p>
 * Never throws. Every repair that changes the shape of the answer lowers
 * confidence or forces review; cosmetic defaults do not. Running the result
 * through again yields the same brief.
 * <p>
 * Order matters for that last property: root sources are cleaned first,
 * options are completed next, retrieved passages are injected after that, and
 * option/action references are filtered against the final root list last.
 */
@Slf4j
@Component
public class AdvisoryBriefValidator {

    static final int REQUIRED_OPTIONS = 3;
    static final double DEFAULT_CONFIDENCE = 0.5d;
    static final double NO_OPTIONS_CONFIDENCE = 0.4d;
    static final double MISSING_OPTIONS_PENALTY = 0.15d;
    static final double CONFIDENCE_FLOOR = 0.3d;
    static final double NO_SOURCES_CONFIDENCE_CAP = 0.35d;
    static final int INJECTED_PARAPHRASE_MAX = 200;

    static final String DEFAULT_SUMMARY = "Ethical analysis based on Bhagavad Geeta principles.";
    static final List<String> DEFAULT_REFLECTION_PROMPTS = List.of(
            "What is my duty in this situation?",
            "How can I act with integrity?");
    static final List<String> DEFAULT_STEPS = List.of(
            "Reflect on the situation",
            "Consider all perspectives",
            "Act with clarity and integrity");
    static final String PLACEHOLDER_DESCRIPTION = "An alternative approach";

    private final AdvisorEngineRagConfig ragConfig;
    private final CanonicalIds canonicalIds;

    public AdvisoryBriefValidator(AdvisorEngineRagConfig ragConfig) {
        this.ragConfig = ragConfig;
        this.canonicalIds = new CanonicalIds(ragConfig.getCanonicalIdPrefix());
    }

    /**
     * Re-validates a brief this engine already produced. Its policy flag and
     * warnings are kept as they are.
     */
    public AdvisoryBrief validate(AdvisoryBrief brief, List<RetrievedPassage> passages) {
        if (brief == null) {
            return validate((JsonNode) null, passages);
        }
        return repair(JsonUtil.toTree(brief), passages, brief.policyViolation(), brief.warnings());
    }

    /**
     * Repairs model output. Any policy flag or warnings it carries are discarded.
     */
    public AdvisoryBrief validate(JsonNode raw, List<RetrievedPassage> passages) {
        if (raw != null && (raw.has(POLICY_VIOLATION) || raw.has(WARNINGS))) {
            log.warn("Ignoring model-supplied policy_violation/warnings fields");
        }
        return repair(raw, passages, false, List.of());
    }

    private AdvisoryBrief repair(
            JsonNode raw,
            List<RetrievedPassage> passages,
            boolean policyViolation,
            List<String> warnings
    ) {
        JsonNode input = raw != null && raw.isObject() ? raw : JsonUtil.object();
        List<RetrievedPassage> retrieved = passages == null ? List.of() : passages;
        RepairState state = new RepairState(readConfidence(input));

        List<SourceRef> sources = validateSources(input.get(SOURCES));
        List<BriefOption> options = fixOptions(input.get(OPTIONS), sources, retrieved, state);
        RecommendedAction action = fixRecommendedAction(input.get(RECOMMENDED_ACTION), options.size());

        String summary = JsonUtil.textOrNull(input, EXECUTIVE_SUMMARY);
        if (summary == null) {
            log.warn("Invalid or missing executive_summary, using default");
            summary = DEFAULT_SUMMARY;
        }
        List<String> reflectionPrompts = JsonUtil.textList(input.get(REFLECTION_PROMPTS));
        if (reflectionPrompts.isEmpty()) {
            log.warn("Invalid or missing reflection_prompts, using defaults");
            reflectionPrompts = DEFAULT_REFLECTION_PROMPTS;
        }

        sources = injectPassages(sources, retrieved, state);
        if (sources.isEmpty()) {
            log.error("No valid sources after validation and injection, flagging for review");
            state.confidence = Math.min(state.confidence, NO_SOURCES_CONFIDENCE_CAP);
            state.reviewForced = true;
        }

        Set<String> rootIds = new LinkedHashSet<>();
        sources.forEach(source -> rootIds.add(source.canonicalId()));
        options = filterOptionReferences(options, rootIds);
        action = new RecommendedAction(action.option(), action.steps(), filterReferences(action.sources(), rootIds, "recommended_action"));

        double confidence = round(state.confidence);
        JsonNode claimedFlag = input.get(SCHOLAR_FLAG);
        boolean scholarFlag = (claimedFlag != null && claimedFlag.isBoolean() && claimedFlag.asBoolean())
                || state.reviewForced
                || confidence < ragConfig.getScholarReviewThreshold();

        log.info("Output validation complete: {} options, {} sources, confidence={}, scholar_flag={}",
                options.size(), sources.size(), confidence, scholarFlag);
        return new AdvisoryBrief(
                JsonUtil.textOrNull(input, SUGGESTED_TITLE),
                summary,
                options,
                action,
                reflectionPrompts,
                sources,
                confidence,
                scholarFlag,
                policyViolation,
                warnings);
    }

    public CanonicalIds getCanonicalIds() {
        return canonicalIds;
    }

    private double readConfidence(JsonNode input) {
        JsonNode node = input.get(CONFIDENCE);
        if (node == null || !node.isNumber()) {
            log.warn("Missing or non-numeric confidence, defaulting to {}", DEFAULT_CONFIDENCE);
            return Double.NaN;
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
            log.warn("Invalid confidence value: {}. Defaulting to {}", value, DEFAULT_CONFIDENCE);
            return Double.NaN;
        }
        return value;
    }

    private List<SourceRef> validateSources(JsonNode node) {
        List<SourceRef> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            log.warn("Sources field is not a list, setting to empty");
            return out;
        }
        Set<String> seen = new LinkedHashSet<>();
        int index = 0;
        for (JsonNode item : node) {
            String rejection = rejectSource(item);
            if (rejection != null) {
                log.warn("Source {} validation failed: {}, skipping", index, rejection);
            }
            else if (!seen.add(item.get(CANONICAL_ID).asText())) {
                log.warn("Source {} duplicates {}, skipping", index, item.get(CANONICAL_ID).asText());
            }
            else {
                out.add(new SourceRef(
                        item.get(CANONICAL_ID).asText(),
                        item.get(PARAPHRASE).asText(),
                        item.get(RELEVANCE).asDouble()));
            }
            index++;
        }
        if (out.size() < node.size()) {
            log.warn("Removed {} invalid sources ({} valid sources remain)", node.size() - out.size(), out.size());
        }
        return out;
    }

    private String rejectSource(JsonNode item) {
        if (item == null || !item.isObject()) {
            return "not an object";
        }
        JsonNode id = item.get(CANONICAL_ID);
        if (id == null || !id.isTextual()) {
            return "missing or invalid canonical_id";
        }
        if (!canonicalIds.isValid(id.asText())) {
            return "canonical_id invalid format: " + id.asText();
        }
        if (JsonUtil.textOrNull(item, PARAPHRASE) == null) {
            return "missing or empty paraphrase";
        }
        JsonNode relevance = item.get(RELEVANCE);
        if (relevance == null || !relevance.isNumber() || relevance.asDouble() < 0.0d || relevance.asDouble() > 1.0d) {
            return "invalid relevance: " + relevance;
        }
        return null;
    }

    private List<BriefOption> fixOptions(
            JsonNode node,
            List<SourceRef> sources,
            List<RetrievedPassage> retrieved,
            RepairState state
    ) {
        List<BriefOption> options = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isObject()) {
                    log.warn("Option {} is not an object, skipping", options.size());
                    continue;
                }
                options.add(coerceOption(item, options.size() + 1));
            }
        }

        int count = options.size();
        if (count == REQUIRED_OPTIONS) {
            return options;
        }

        state.reviewForced = true;
        if (count > REQUIRED_OPTIONS) {
            if (ragConfig.getExcessOptionPolicy() == ExcessOptionPolicy.TRUNCATE) {
                log.warn("LLM returned {} options instead of {}, dropping {}: {}", count, REQUIRED_OPTIONS,
                        count - REQUIRED_OPTIONS, options.subList(REQUIRED_OPTIONS, count).stream().map(BriefOption::title).toList());
                return new ArrayList<>(options.subList(0, REQUIRED_OPTIONS));
            }
            log.warn("LLM returned {} options instead of {}, keeping all", count, REQUIRED_OPTIONS);
            return options;
        }

        List<String> candidates = unusedSourceIds(options, sources, retrieved);
        if (count == 0) {
            log.warn("No options found in LLM response. Generating default options.");
            state.confidence = NO_OPTIONS_CONFIDENCE;
            return defaultOptions(candidates);
        }

        log.warn("LLM returned {} options instead of required {}. Filling gaps.", count, REQUIRED_OPTIONS);
        state.confidence = penalize(state.confidence, MISSING_OPTIONS_PENALTY);
        int next = 0;
        while (options.size() < REQUIRED_OPTIONS) {
            int position = options.size() + 1;
            List<String> cited = next < candidates.size() ? List.of(candidates.get(next++)) : List.of();
            options.add(new BriefOption(
                    "Option " + position + ": Alternative Perspective",
                    "A balanced approach considering different perspectives and values from Bhagavad Geeta wisdom",
                    List.of("Considers multiple viewpoints", "Grounded in principles", "Sustainable long-term"),
                    List.of("Requires careful implementation", "May involve compromise"),
                    cited));
            log.info("Generated missing Option {} to meet requirement of {} options", position, REQUIRED_OPTIONS);
        }
        return options;
    }

    private BriefOption coerceOption(JsonNode item, int position) {
        String title = JsonUtil.textOrNull(item, TITLE);
        String description = JsonUtil.textOrNull(item, DESCRIPTION);
        if (title == null || description == null || !item.path(PROS).isArray()
                || !item.path(CONS).isArray() || !item.path(SOURCES).isArray()) {
            log.warn("Option {} is structurally incomplete, coercing fields", position);
        }
        List<String> cited = new ArrayList<>();
        for (String id : JsonUtil.textList(item.get(SOURCES))) {
            if (canonicalIds.isValid(id)) {
                cited.add(id);
            }
            else {
                log.warn("Option {}: dropping malformed source id {}", position, id);
            }
        }
        return new BriefOption(
                title == null ? "Option " + position : title,
                description == null ? PLACEHOLDER_DESCRIPTION : description,
                JsonUtil.textList(item.get(PROS)),
                JsonUtil.textList(item.get(CONS)),
                cited);
    }

    // root ids not cited by any option, then retrieved ids not yet listed
    private List<String> unusedSourceIds(List<BriefOption> options, List<SourceRef> sources, List<RetrievedPassage> retrieved) {
        Set<String> cited = new LinkedHashSet<>();
        options.forEach(option -> cited.addAll(option.sources()));
        Set<String> candidates = new LinkedHashSet<>();
        for (SourceRef source : sources) {
            if (!cited.contains(source.canonicalId())) {
                candidates.add(source.canonicalId());
            }
        }
        for (RetrievedPassage passage : retrieved) {
            if (canonicalIds.isValid(passage.canonicalId()) && !cited.contains(passage.canonicalId())) {
                candidates.add(passage.canonicalId());
            }
        }
        return new ArrayList<>(candidates);
    }

    private List<BriefOption> defaultOptions(List<String> candidates) {
        return List.of(
                new BriefOption(
                        "Option 1: Path of Duty and Dharma",
                        "Follow your rightful duty with focus on principles rather than outcomes, aligning with core Geeta teachings",
                        List.of("Aligns with dharma and personal duty", "Promotes spiritual growth", "Creates positive karma"),
                        List.of("May require immediate sacrifice", "Outcomes uncertain"),
                        candidateAt(candidates, 0)),
                new BriefOption(
                        "Option 2: Balanced Approach with Flexibility",
                        "Integrate duty with pragmatic considerations, adapting to circumstances while maintaining ethical principles",
                        List.of("Balances ideals with reality", "Allows for adaptation", "Considers stakeholders"),
                        List.of("Requires ongoing reflection", "May appear uncertain"),
                        candidateAt(candidates, 1)),
                new BriefOption(
                        "Option 3: Seek Deeper Understanding",
                        "Pause for reflection and deeper inquiry into your values, circumstances, and the wisdom traditions before committing",
                        List.of("Builds clarity and confidence", "Reduces future regret", "Honors complexity"),
                        List.of("Delays decision-making", "May require more effort"),
                        candidateAt(candidates, 2)));
    }

    private List<String> candidateAt(List<String> candidates, int index) {
        return index < candidates.size() ? List.of(candidates.get(index)) : List.of();
    }

    private RecommendedAction fixRecommendedAction(JsonNode node, int optionCount) {
        if (node == null || !node.isObject()) {
            log.warn("Invalid recommended_action structure, using default");
            return new RecommendedAction(1, DEFAULT_STEPS, List.of());
        }
        JsonNode optionNode = node.get(OPTION);
        int option = 1;
        if (optionNode != null && optionNode.isIntegralNumber()
                && optionNode.asInt() >= 1 && optionNode.asInt() <= optionCount) {
            option = optionNode.asInt();
        }
        else {
            log.warn("Invalid recommended_action.option: {}, defaulting to 1", optionNode);
        }
        List<String> steps = JsonUtil.textList(node.get(STEPS));
        if (steps.isEmpty()) {
            log.warn("Invalid or missing recommended_action.steps");
            steps = DEFAULT_STEPS;
        }
        List<String> cited = new ArrayList<>();
        for (String id : JsonUtil.textList(node.get(SOURCES))) {
            if (canonicalIds.isValid(id)) {
                cited.add(id);
            }
        }
        return new RecommendedAction(option, steps, cited);
    }

    private List<SourceRef> injectPassages(List<SourceRef> sources, List<RetrievedPassage> retrieved, RepairState state) {
        int minSources = ragConfig.getMinSources();
        if (sources.size() >= minSources) {
            return sources;
        }
        if (retrieved.isEmpty()) {
            log.warn("Sources below minimum ({} < {}) but no retrieved passages available to inject", sources.size(), minSources);
            return sources;
        }

        List<SourceRef> out = new ArrayList<>(sources);
        Set<String> existing = new LinkedHashSet<>();
        sources.forEach(source -> existing.add(source.canonicalId()));
        int injected = 0;
        for (RetrievedPassage passage : retrieved) {
            if (out.size() >= minSources) {
                break;
            }
            String id = passage.canonicalId();
            if (!canonicalIds.isValid(id) || existing.contains(id)) {
                continue;
            }
            String paraphrase = injectedParaphrase(passage);
            if (paraphrase == null) {
                continue;
            }
            out.add(new SourceRef(id, paraphrase, passage.relevance()));
            existing.add(id);
            injected++;
            log.info("Injected retrieved passage {} (relevance: {})", id, passage.relevance());
        }

        if (injected > 0) {
            double penalty = ragConfig.getInjectionPenalty() * injected;
            state.confidence = penalize(state.confidence, penalty);
            log.warn("Injected {} retrieved passages (sources now: {}). Confidence penalty: -{}",
                    injected, out.size(), penalty);
        }
        return out;
    }

    private String injectedParaphrase(RetrievedPassage passage) {
        String translation = passage.metadataText(RetrievedPassage.META_TRANSLATION);
        if (translation != null) {
            return translation;
        }
        String paraphrase = passage.metadataText(RetrievedPassage.META_PARAPHRASE);
        if (paraphrase != null) {
            return paraphrase;
        }
        String text = passage.text();
        if (text == null || text.isBlank()) {
            return null;
        }
        return truncateAtWordBoundary(text.strip(), INJECTED_PARAPHRASE_MAX);
    }

    private List<BriefOption> filterOptionReferences(List<BriefOption> options, Set<String> rootIds) {
        List<BriefOption> out = new ArrayList<>(options.size());
        for (int i = 0; i < options.size(); i++) {
            BriefOption option = options.get(i);
            out.add(new BriefOption(option.title(), option.description(), option.pros(), option.cons(),
                    filterReferences(option.sources(), rootIds, "option " + i)));
        }
        return out;
    }

    // with an empty root list, syntactically valid orphans are kept
    private List<String> filterReferences(List<String> references, Set<String> rootIds, String owner) {
        Set<String> kept = new LinkedHashSet<>();
        List<String> removed = new ArrayList<>();
        for (String id : references) {
            if (rootIds.isEmpty() || rootIds.contains(id)) {
                kept.add(id);
            }
            else {
                removed.add(id);
            }
        }
        if (!removed.isEmpty()) {
            log.warn("{}: removed source refs missing from root sources: {}", owner, removed);
        }
        return new ArrayList<>(kept);
    }

    // never raises a confidence that is already below the floor
    private double penalize(double confidence, double penalty) {
        if (confidence <= CONFIDENCE_FLOOR) {
            return confidence;
        }
        return Math.max(confidence - penalty, CONFIDENCE_FLOOR);
    }

    private static double round(double confidence) {
        double value = Math.max(0.0d, Math.min(1.0d, confidence));
        return Math.round(value * 10000.0d) / 10000.0d;
    }

    static String truncateAtWordBoundary(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        String head = text.substring(0, max);
        int lastSpace = head.lastIndexOf(' ');
        if (lastSpace < max / 2) {
            return head + "…";
        }
        return head.substring(0, lastSpace) + "…";
    }

    private static final class RepairState {
        private double confidence;
        private boolean reviewForced;

        // NaN marks a missing or invalid claimed confidence
        private RepairState(double confidence) {
            this.reviewForced = Double.isNaN(confidence);
            this.confidence = reviewForced ? DEFAULT_CONFIDENCE : confidence;
        }
    }
}
