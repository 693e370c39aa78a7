package com.github.salilvnair.advisorengine.refusal;

import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.advisorengine.support.TestConstants.REFUSAL_TEXT;
import static com.github.salilvnair.advisorengine.support.TestConstants.VALID_BRIEF_JSON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefusalDetectorTest {

    private AdvisorEngineRagConfig ragConfig;
    private RefusalDetector detector;

    @BeforeEach
    void setUp() {
        ragConfig = new AdvisorEngineRagConfig();
        detector = new RefusalDetector(ragConfig);
    }

    @Test
    void detectsPlainRefusal() {
        RefusalVerdict verdict = detector.detect(REFUSAL_TEXT);

        assertTrue(verdict.refusal());
        assertEquals("I cannot help", verdict.matchedPattern());
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertTrue(detector.detect("i must decline this request.").refusal());
    }

    @Test
    void consultationJsonIsNeverARefusal() {
        String json = "{\"executive_summary\": \"I cannot help feeling torn, but duty is clear.\", \"options\": []}";

        assertFalse(detector.detect(json).refusal());
        assertFalse(detector.detect(VALID_BRIEF_JSON).refusal());
    }

    @Test
    void fencedConsultationJsonIsNeverARefusal() {
        String fenced = "```json\n{\"options\": [], \"note\": \"I cannot help you decide alone\"}\n```";

        assertFalse(detector.detect(fenced).refusal());
    }

    @Test
    void phrasesInsideDoubleQuotesAreIgnored() {
        String text = "The colleague said \"I cannot help you with the audit\" and walked away.";

        assertFalse(detector.detect(text).refusal());
    }

    @Test
    void phrasesInsideSingleQuotesAreIgnored() {
        String text = "My peer replied 'I won't help cover this up' during the meeting.";

        assertFalse(detector.detect(text).refusal());
    }

    @Test
    void contractionsDoNotOpenQuotes() {
        String text = "We don't have much time. I cannot assist with this request.";

        assertTrue(detector.detect(text).refusal());
    }

    @Test
    void onlyTheLeadingWindowIsScanned() {
        String text = "x".repeat(RefusalDetector.SCAN_WINDOW + 100) + " " + REFUSAL_TEXT;

        assertFalse(detector.detect(text).refusal());
    }

    @Test
    void disabledDetectionNeverFlags() {
        ragConfig.setRefusalDetectionEnabled(false);

        assertFalse(detector.detect(REFUSAL_TEXT).refusal());
    }

    @Test
    void blankTextIsNotARefusal() {
        assertFalse(detector.detect("  ").refusal());
        assertFalse(detector.detect(null).refusal());
    }

    @Test
    void quoteParityDecidesInsideQuotes() {
        assertTrue(RefusalDetector.insideQuotes("say \"hello", 10));
        assertFalse(RefusalDetector.insideQuotes("say \"hello\" now", 15));
        assertTrue(RefusalDetector.insideQuotes("he said 'no", 11));
    }
}
