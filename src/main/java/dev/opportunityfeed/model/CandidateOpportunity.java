package dev.opportunityfeed.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * A normalized posting produced by a source, not yet admitted into storage.
 */
@Data
@Builder(toBuilder = true)
public class CandidateOpportunity {
    private String title;
    private String company;
    private String location;
    private OpportunityType type;
    private String category;     // keyword-derived tag (Technology, Business, ...)
    private String description;
    private String requirements;
    private String salary;
    private LocalDate deadline;
    private String applicationUrl;

    // Provenance
    private String source;       // registry name of the producing source
    private String sourceId;     // source-local identifier, may be null
    private String sourceUrl;

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasSourceIdentity() {
        return source != null && !source.isBlank() && sourceId != null && !sourceId.isBlank();
    }
}
