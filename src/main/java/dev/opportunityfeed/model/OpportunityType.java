package dev.opportunityfeed.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of posting. Serialized to JSON by its lowercase value.
 */
public enum OpportunityType {
    JOB,
    INTERNSHIP,
    WORKSHOP,
    CONFERENCE,
    COMPETITION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup by value ("job", "Internship", ...). Unknown values yield empty.
     */
    public static Optional<OpportunityType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OpportunityType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
