package com.github.salilvnair.advisorengine.refusal;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.advisorengine.config.AdvisorEngineRagConfig;
import com.github.salilvnair.advisorengine.engine.constants.BriefFields;
import com.github.salilvnair.advisorengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spots model policy refusals in raw provider text before any JSON parsing.
 * <ul>
 *   <li>A response that already parses as a consultation-shaped object is never a refusal.</li>
 *   <li>Only the first 500 characters are scanned.</li>
 *   <li>Matches inside a quoted string are ignored.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefusalDetector {

    static final int SCAN_WINDOW = 500;

    private static final List<Pattern> REFUSAL_PATTERNS = compile(
            "I (?:can't|cannot|won't|am not able to|'m not able to) (?:assist|help|provide|create|generate|write)",
            "I'm (?:sorry|afraid),? (?:but )?I (?:can't|cannot|won't)",
            "(?:This|That|Your) (?:request|content|message) (?:appears to |seems to )?(?:contain|include|involve)",
            "(?:inappropriate|explicit|harmful|offensive) (?:content|material|request)",
            "(?:violates?|against) (?:my |our )?(?:guidelines|policies|terms|content policy)",
            "not (?:able|willing|going) to (?:assist|help|provide|engage) with (?:this|that|such)",
            "(?:outside|beyond) (?:my|the) (?:scope|boundaries|capabilities)",
            "I (?:must|need to) (?:decline|refuse|respectfully decline)",
            "I apologize,? but I (?:can't|cannot|won't)",
            "I'm designed to (?:be helpful|assist),? (?:but|however) I (?:can't|cannot)",
            "I don't (?:feel comfortable|think I should) (?:assist|help|provide)",
            "(?:ethically|safely) (?:unable|cannot) to (?:assist|help|provide)",
            "not something I(?:'m able| can) (?:to )?(?:help|assist) with");

    // opening single quote: start, whitespace or punctuation, followed by a word character
    private static final Pattern SINGLE_QUOTE_OPENER = Pattern.compile("(?:^|[\\s,;:({])'(?=\\w)");

    private final AdvisorEngineRagConfig ragConfig;

    public RefusalVerdict detect(String rawText) {
        if (!ragConfig.isRefusalDetectionEnabled() || rawText == null || rawText.isBlank()) {
            return RefusalVerdict.none();
        }
        if (looksLikeConsultation(rawText)) {
            log.debug("Response contains consultation JSON, not a refusal");
            return RefusalVerdict.none();
        }

        String window = rawText.length() > SCAN_WINDOW ? rawText.substring(0, SCAN_WINDOW) : rawText;
        for (Pattern pattern : REFUSAL_PATTERNS) {
            Matcher matcher = pattern.matcher(window);
            while (matcher.find()) {
                if (insideQuotes(window, matcher.start())) {
                    log.debug("Refusal pattern '{}' found inside quotes, skipping", matcher.group());
                    continue;
                }
                log.warn("LLM refusal detected in response (matched: '{}')", matcher.group());
                return RefusalVerdict.matched(matcher.group());
            }
        }
        return RefusalVerdict.none();
    }

    boolean looksLikeConsultation(String rawText) {
        String candidate = stripLeadingFence(rawText.strip());
        JsonNode node = JsonUtil.parseOrNull(candidate);
        if (!node.isObject()) {
            return false;
        }
        return node.has(BriefFields.EXECUTIVE_SUMMARY) || node.path(BriefFields.OPTIONS).isArray();
    }

    static boolean insideQuotes(String text, int matchStart) {
        String before = text.substring(0, matchStart);
        int doubleQuotes = count(before, "\"") - count(before, "\\\"");
        // lookahead needs the character after the quote, so scan the full text
        Matcher openers = SINGLE_QUOTE_OPENER.matcher(text);
        int singleOpeners = 0;
        while (openers.find() && openers.end() <= matchStart) {
            singleOpeners++;
        }
        return singleOpeners % 2 == 1 || doubleQuotes % 2 == 1;
    }

    private static String stripLeadingFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        StringBuilder body = new StringBuilder();
        boolean inBlock = false;
        for (String line : text.split("\n", -1)) {
            if (line.startsWith("```")) {
                if (inBlock) {
                    break;
                }
                inBlock = true;
                continue;
            }
            if (inBlock) {
                body.append(line).append('\n');
            }
        }
        return body.toString();
    }

    private static int count(String haystack, String needle) {
        int total = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            total++;
            from += needle.length();
        }
        return total;
    }

    private static List<Pattern> compile(String... patterns) {
        return Arrays.stream(patterns)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
