package dev.opportunityfeed.ai;

import org.apache.commons.lang3.StringUtils;

/**
 * Prompt asking the model whether a post offers a real opportunity.
 */
public final class ClassificationPromptBuilder {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final String TEMPLATE = """
            You review posts collected for a board that lists jobs, internships, workshops, \
            conferences and competitions. Decide whether the post below OFFERS something a reader \
            can apply to, register for or attend.

            Answer true only when an employer or organizer is offering a position, program or event.
            Answer false for questions, requests for advice, discussions about opportunities, \
            people looking for work or advertising themselves, and anything else that offers nothing.

            Examples that are opportunities:
            - "[Hiring] Backend Engineer (Remote) - send your CV to..."
            - "Summer 2025 internship program now accepting applications"
            - "Free data science workshop this Saturday, register here"

            Examples that are not:
            - "How do I get an internship with no experience?"
            - "Which conference is worth attending this year?"
            - "[For Hire] Frontend developer available for contract work"

            Questions and advice requests are always false. If unsure, answer false.

            SOURCE: %s
            TITLE: %s
            DESCRIPTION: %s

            Reply with a single JSON object and nothing else:
            {"is_opportunity": true or false, "confidence": number between 0.0 and 1.0, "reasoning": "one short sentence"}
            """;

    private ClassificationPromptBuilder() {
    }

    public static String build(String title, String description, String source) {
        String body = description == null ? "" : description.trim();
        if (body.length() > MAX_DESCRIPTION_LENGTH) {
            body = StringUtils.abbreviate(body, MAX_DESCRIPTION_LENGTH + 3);
        }
        return String.format(TEMPLATE,
                source == null ? "unknown" : source,
                title == null ? "" : title.trim(),
                body);
    }
}
