package com.github.salilvnair.advisorengine.engine.constants;

import lombok.experimental.UtilityClass;

/**
 * Wire field names of the advisory brief.
 */
@UtilityClass
public class BriefFields {
    public static final String SUGGESTED_TITLE = "suggested_title";
    public static final String EXECUTIVE_SUMMARY = "executive_summary";
    public static final String OPTIONS = "options";
    public static final String RECOMMENDED_ACTION = "recommended_action";
    public static final String REFLECTION_PROMPTS = "reflection_prompts";
    public static final String SOURCES = "sources";
    public static final String CONFIDENCE = "confidence";
    public static final String SCHOLAR_FLAG = "scholar_flag";
    public static final String POLICY_VIOLATION = "policy_violation";
    public static final String WARNINGS = "warnings";

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PROS = "pros";
    public static final String CONS = "cons";
    public static final String OPTION = "option";
    public static final String STEPS = "steps";
    public static final String CANONICAL_ID = "canonical_id";
    public static final String PARAPHRASE = "paraphrase";
    public static final String RELEVANCE = "relevance";
}
