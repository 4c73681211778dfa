package dev.opportunityfeed.source.impl;

import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.normalize.OpportunityNormalizer;

import java.util.Locale;
import java.util.Optional;

/**
 * Per-feed differences in how company and type are derived.
 */
public enum FeedFlavor {

    GENERIC {
        @Override
        String company(String author, String title) {
            return author != null ? author : OpportunityNormalizer.companyFromTitle(title);
        }
    },

    /**
     * Reddit authors are user handles, never companies.
     */
    REDDIT {
        @Override
        String company(String author, String title) {
            return OpportunityNormalizer.companyFromTitle(title);
        }
    },

    EVENTBRITE {
        @Override
        String company(String author, String title) {
            return GENERIC.company(author, title);
        }

        @Override
        OpportunityType type(String title, String description, String sourceName) {
            return OpportunityNormalizer.classifyEventType(title, description);
        }
    },

    /**
     * Company is the author; nothing is derived from the title.
     */
    GITHUB {
        @Override
        String company(String author, String title) {
            return author != null ? author : OpportunityNormalizer.UNKNOWN_COMPANY;
        }
    };

    abstract String company(String author, String title);

    OpportunityType type(String title, String description, String sourceName) {
        return OpportunityNormalizer.classifyType(title, description, sourceName);
    }

    /**
     * Lenient lookup; blank means {@link #GENERIC}, unknown values yield empty.
     */
    public static Optional<FeedFlavor> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(GENERIC);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (FeedFlavor flavor : values()) {
            if (flavor.name().equals(normalized)) {
                return Optional.of(flavor);
            }
        }
        return Optional.empty();
    }
}
