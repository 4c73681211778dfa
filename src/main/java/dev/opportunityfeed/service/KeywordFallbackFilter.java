package dev.opportunityfeed.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for the classifier when it cannot answer. Conservative: a post is
 * admitted only when it carries explicit hiring or opportunity language.
 */
@Slf4j
@Component
public class KeywordFallbackFilter {

    private static final Set<String> INTERROGATIVES = Set.of(
            "how", "what", "where", "when", "why", "who", "which", "whats", "what's",
            "is", "are", "can", "could", "should", "does", "do", "did", "has", "have",
            "any", "anyone", "anybody", "would", "will");

    private static final List<String> HIRING_TAGS = List.of(
            "[hiring]", "(hiring)", "hiring:", "#hiring", "[job]", "[internship]");

    private static final List<String> HIRING_PHRASES = List.of(
            "we are hiring", "we're hiring", "now hiring", "is hiring", "are hiring", "hiring",
            "apply now", "apply at", "apply here", "apply by", "how to apply",
            "job opening", "open position", "open role", "position available", "positions available",
            "job posting", "accepting applications", "applications open", "applications are open",
            "internship program", "paid internship", "join our team", "is looking for a",
            "seeking a", "seeking an", "register now", "registration open", "call for participants",
            "call for papers", "full-time", "part-time");

    private static final List<String> ADVICE_PHRASES = List.of(
            "advice", "any suggestions", "suggestions?", "recommendations", "tips",
            "help me", "need help", "how do i", "how can i", "what should i", "should i",
            "anyone know", "has anyone", "does anyone");

    private static final List<String> SELF_PROMOTION_PHRASES = List.of(
            "[for hire]", "(for hire)", "for hire", "hire me", "available for", "looking for work",
            "looking for a job", "looking for an internship", "seeking employment", "open to work",
            "my portfolio", "i am available", "i'm available");

    private static final Pattern LEADING_TAGS = Pattern.compile("^(\\s*[\\[(][^\\])]*[\\])]\\s*)+");
    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z']");

    /**
     * True when the post reads like an offer of a job, program or event.
     */
    public boolean isLikelyOpportunity(String title, String description) {
        String titleLower = title == null ? "" : title.toLowerCase(Locale.ROOT).trim();
        String text = titleLower + " " + (description == null ? "" : description.toLowerCase(Locale.ROOT));

        boolean hiringTag = containsAny(text, HIRING_TAGS);
        boolean hiringLanguage = hiringTag || containsAny(text, HIRING_PHRASES);

        if (startsWithInterrogative(titleLower) && !hiringLanguage) {
            log.debug("Fallback rejected question: '{}'", title);
            return false;
        }
        if (containsAny(text, ADVICE_PHRASES) && !hiringLanguage) {
            log.debug("Fallback rejected advice request: '{}'", title);
            return false;
        }
        if (containsAny(text, SELF_PROMOTION_PHRASES) && !hiringTag) {
            log.debug("Fallback rejected self-promotion: '{}'", title);
            return false;
        }
        return hiringLanguage;
    }

    static boolean startsWithInterrogative(String titleLower) {
        String stripped = LEADING_TAGS.matcher(titleLower).replaceFirst("").trim();
        if (stripped.isEmpty()) {
            return false;
        }
        String firstWord = NON_LETTERS.matcher(stripped.split("\\s+")[0]).replaceAll("");
        return INTERROGATIVES.contains(firstWord);
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
