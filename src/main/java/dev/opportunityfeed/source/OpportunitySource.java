package dev.opportunityfeed.source;

import dev.opportunityfeed.model.SourceFetchResult;
import reactor.core.publisher.Mono;

/**
 * One external origin of postings (a feed or an API).
 */
public interface OpportunitySource {

    /**
     * Registry name of this source (e.g. "jooble", "reddit_internships").
     */
    String getName();

    /**
     * Fetch and normalize everything the source currently offers.
     * Never signals an error: failures come back as an error count on the result.
     */
    Mono<SourceFetchResult> fetch();

    /**
     * Sources that need credentials report false when they have none.
     */
    default boolean isEnabled() {
        return true;
    }
}
