package com.github.salilvnair.advisorengine.engine;

import com.github.salilvnair.advisorengine.model.AdvisoryBrief;
import com.github.salilvnair.advisorengine.model.BriefOption;
import com.github.salilvnair.advisorengine.model.RecommendedAction;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Canned briefs for the branches where no model output can be used.
 */
@UtilityClass
public class FixedBriefs {

    public static final double FALLBACK_CONFIDENCE = 0.1d;
    public static final double POLICY_VIOLATION_CONFIDENCE = 0.0d;

    private static final AdvisoryBrief FALLBACK = new AdvisoryBrief(
            null,
            "We couldn't complete your consultation right now. Please try again in a few moments, "
                    + "or explore the relevant verses below for guidance.",
            List.of(
                    new BriefOption(
                            "Take Time to Reflect",
                            "Give yourself space to contemplate this situation before acting.",
                            List.of("Clarity through reflection", "Avoid hasty decisions"),
                            List.of("Delayed action", "Prolonged uncertainty"),
                            List.of()),
                    new BriefOption(
                            "Seek Trusted Counsel",
                            "Discuss your situation with someone you trust: a mentor, friend, or family member.",
                            List.of("Fresh perspective", "Emotional support"),
                            List.of("May take time to arrange", "Opinions may vary"),
                            List.of()),
                    new BriefOption(
                            "Study the Verses Directly",
                            "Explore the Bhagavad Geeta verses related to your situation for timeless wisdom.",
                            List.of("Direct access to wisdom", "Personal interpretation"),
                            List.of("Requires contemplation", "May need guidance"),
                            List.of())),
            new RecommendedAction(
                    3,
                    List.of(
                            "Browse the verses suggested for your situation",
                            "Read the translations and paraphrases carefully",
                            "Reflect on how the teachings apply to your circumstances",
                            "Return later to try your consultation again"),
                    List.of()),
            List.of(
                    "What are my core values in this situation?",
                    "Who will be affected by my decision?",
                    "What would I advise someone else in this situation?"),
            List.of(),
            FALLBACK_CONFIDENCE,
            true,
            false,
            List.of());

    private static final AdvisoryBrief POLICY_VIOLATION = new AdvisoryBrief(
            null,
            "We weren't able to provide guidance for this request. This service is designed to help with "
                    + "genuine ethical dilemmas: difficult decisions where values conflict, such as workplace "
                    + "integrity, family responsibilities, or leadership challenges.",
            List.of(
                    new BriefOption(
                            "Reflect on Your Underlying Concern",
                            "If there's a genuine ethical question beneath your request, consider what values are "
                                    + "truly in tension and what decision you're actually facing.",
                            List.of("Clarifies your real question", "Opens path to meaningful guidance"),
                            List.of("Requires honest self-reflection"),
                            List.of()),
                    new BriefOption(
                            "Rephrase Your Dilemma",
                            "Try describing your situation differently: What's the ethical tension? Who are the "
                                    + "stakeholders? What values are in conflict?",
                            List.of("May unlock relevant guidance", "Focuses on actionable elements"),
                            List.of("Requires effort to articulate"),
                            List.of()),
                    new BriefOption(
                            "Explore the Bhagavad Geeta Directly",
                            "Browse the verse collection to find wisdom that resonates with your situation. The Geeta "
                                    + "addresses duty, action, detachment, and ethical living.",
                            List.of("Direct access to timeless wisdom", "Self-directed exploration"),
                            List.of("Less structured guidance"),
                            List.of())),
            new RecommendedAction(
                    2,
                    List.of(
                            "Identify the core decision you're facing",
                            "Note the stakeholders who would be affected",
                            "Describe the values or principles in tension",
                            "Submit a new consultation with this framing"),
                    List.of()),
            List.of(
                    "What ethical tension am I truly wrestling with?",
                    "If I described this situation to a wise mentor, how would I frame it?",
                    "What would acting with integrity look like in my circumstances?"),
            List.of(),
            POLICY_VIOLATION_CONFIDENCE,
            true,
            true,
            List.of());

    /** The "reflect and retry later" brief. */
    public static AdvisoryBrief fallback() {
        return FALLBACK;
    }

    public static AdvisoryBrief policyViolation() {
        return POLICY_VIOLATION;
    }
}
