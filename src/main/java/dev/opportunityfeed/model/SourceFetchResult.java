package dev.opportunityfeed.model;

import java.util.List;

/**
 * What one {@code fetch()} call of a source produced. Error counts travel with the result
 * instead of living on the source instance.
 */
public record SourceFetchResult(
        String source,
        List<CandidateOpportunity> candidates,
        int errors,
        String errorMessage) {

    public SourceFetchResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static SourceFetchResult empty(String source) {
        return new SourceFetchResult(source, List.of(), 0, null);
    }

    public static SourceFetchResult of(String source, List<CandidateOpportunity> candidates, int errors) {
        return new SourceFetchResult(source, candidates, errors, null);
    }

    public static SourceFetchResult failed(String source, int errors, String errorMessage) {
        return new SourceFetchResult(source, List.of(), Math.max(1, errors), errorMessage);
    }
}
