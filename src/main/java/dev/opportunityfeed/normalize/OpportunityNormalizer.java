package dev.opportunityfeed.normalize;

import dev.opportunityfeed.model.OpportunityType;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field normalization shared by all sources: categories, types, dates, HTML and text shaping.
 * Pure and deterministic.
 */
public final class OpportunityNormalizer {

    public static final String UNKNOWN_COMPANY = "Unknown Company";
    public static final String DEFAULT_LOCATION = "Remote";
    public static final String GENERAL_CATEGORY = "General";

    private static final List<String> TECHNOLOGY_KEYWORDS = List.of(
            "software", "developer", "programming", "coding", "python", "javascript", "java",
            "tech", "technology", "IT", "computer");
    private static final List<String> BUSINESS_KEYWORDS = List.of(
            "business", "marketing", "sales", "finance", "management", "analyst");
    private static final List<String> DESIGN_KEYWORDS = List.of(
            "design", "ui", "ux", "graphic", "creative", "art");
    private static final List<String> EDUCATION_KEYWORDS = List.of(
            "education", "teaching", "research", "academic");

    private static final List<String> INTERNSHIP_KEYWORDS = List.of("internship", "intern");
    private static final List<String> COMPETITION_KEYWORDS = List.of("competition", "hackathon", "contest");
    private static final List<String> JOB_KEYWORDS = List.of(
            "job", "position", "career", "hiring", "job opening");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss zzz", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ENGLISH));

    private static final List<Pattern> LOCATION_PATTERNS = List.of(
            Pattern.compile("(?i:location)[:\\s]+([A-Z][a-z]+(?:\\s*,\\s*[A-Z]{2})?)"),
            Pattern.compile("(?i:based in) ([A-Z][a-z]+(?:\\s*,\\s*[A-Z]{2})?)"),
            Pattern.compile("([A-Z][a-z]+,\\s*[A-Z]{2})\\b"));

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private OpportunityNormalizer() {
    }

    /**
     * Keyword category; first matching set wins: Technology, Business, Design, Education.
     */
    public static String categorize(String title, String description) {
        String text = join(title, description);
        if (containsAny(text, TECHNOLOGY_KEYWORDS)) {
            return "Technology";
        }
        if (containsAny(text, BUSINESS_KEYWORDS)) {
            return "Business";
        }
        if (containsAny(text, DESIGN_KEYWORDS)) {
            return "Design";
        }
        if (containsAny(text, EDUCATION_KEYWORDS)) {
            return "Education";
        }
        return GENERAL_CATEGORY;
    }

    /**
     * Keyword type; first match wins: internship, conference, workshop, competition, job.
     * Conference and workshop also match on the source name. Without any match, meetup and
     * eventbrite sources default to workshop, everything else to job.
     */
    public static OpportunityType classifyType(String title, String description, String sourceHint) {
        String text = join(title, description);
        String source = sourceHint == null ? "" : sourceHint.toLowerCase(Locale.ROOT);

        if (containsAny(text, INTERNSHIP_KEYWORDS)) {
            return OpportunityType.INTERNSHIP;
        }
        if (containsWord(text, "conference") || source.contains("conference")) {
            return OpportunityType.CONFERENCE;
        }
        if (containsWord(text, "workshop") || source.contains("workshop")) {
            return OpportunityType.WORKSHOP;
        }
        if (containsAny(text, COMPETITION_KEYWORDS)) {
            return OpportunityType.COMPETITION;
        }
        if (containsAny(text, JOB_KEYWORDS)) {
            return OpportunityType.JOB;
        }
        return isEventSource(source) ? OpportunityType.WORKSHOP : OpportunityType.JOB;
    }

    /**
     * Event listings: conference, workshop or competition, defaulting to workshop.
     */
    public static OpportunityType classifyEventType(String title, String description) {
        String text = join(title, description);
        if (containsWord(text, "conference")) {
            return OpportunityType.CONFERENCE;
        }
        if (containsWord(text, "workshop")) {
            return OpportunityType.WORKSHOP;
        }
        if (containsAny(text, COMPETITION_KEYWORDS)) {
            return OpportunityType.COMPETITION;
        }
        return OpportunityType.WORKSHOP;
    }

    /**
     * Best-effort date parsing. Unknown formats yield empty, never an exception.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(value, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
        try {
            TemporalAccessor parsed = format.parse(value);
            return Optional.of(LocalDate.from(parsed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Strip HTML tags from text.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Caps text at {@code maxLength} characters, ellipsis included.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        return StringUtils.abbreviate(text.trim(), Math.max(4, maxLength));
    }

    /**
     * Company from a title such as "Backend Engineer at Acme" or "Backend Engineer - Acme".
     */
    public static String companyFromTitle(String title) {
        if (title == null) {
            return UNKNOWN_COMPANY;
        }
        int at = title.lastIndexOf(" at ");
        if (at >= 0 && at + 4 < title.length()) {
            return title.substring(at + 4).trim();
        }
        int dash = title.lastIndexOf(" - ");
        if (dash >= 0 && dash + 3 < title.length()) {
            return title.substring(dash + 3).trim();
        }
        return UNKNOWN_COMPANY;
    }

    /**
     * Location mentioned in free text ("Location: Austin, TX", "based in Berlin", "Denver, CO").
     */
    public static Optional<String> locationFromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : LOCATION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Source-local id: last path segment of the link, otherwise the slugified title.
     */
    public static String sourceIdFrom(String link, String title) {
        if (link != null && !link.isBlank()) {
            String trimmed = StringUtils.stripEnd(link.trim(), "/");
            String segment = trimmed.substring(trimmed.lastIndexOf('/') + 1);
            if (!segment.isBlank()) {
                return segment;
            }
        }
        return slugify(title);
    }

    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        return StringUtils.left(slug, 100);
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static boolean isEventSource(String source) {
        return source.contains("meetup") || source.contains("eventbrite");
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (containsWord(text, keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whole-word match, plural allowed. Lowercase keywords ignore case; uppercase ones
     * ("IT") must match exactly so they do not fire on ordinary words.
     */
    static boolean containsWord(String text, String keyword) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(keyword, k -> {
            String regex = "\\b" + Pattern.quote(k) + "s?\\b";
            boolean exactCase = !k.equals(k.toLowerCase(Locale.ROOT));
            return exactCase ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        });
        return pattern.matcher(text).find();
    }

    private static String join(String title, String description) {
        return (title == null ? "" : title) + " " + (description == null ? "" : description);
    }
}
