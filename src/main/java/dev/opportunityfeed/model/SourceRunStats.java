package dev.opportunityfeed.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Counters for one source within one ingestion run.
 * Owned by that source's pipeline; candidates of a source are processed sequentially.
 */
@Getter
@ToString
public class SourceRunStats {

    private final String source;
    private final Instant timestamp;
    private int fetched;
    private int created;
    private int updated;
    private int rejected;
    private int errors;
    private boolean skipped;
    private String errorMessage;

    public SourceRunStats(String source) {
        this.source = source;
        this.timestamp = Instant.now();
    }

    public static SourceRunStats skipped(String source) {
        SourceRunStats stats = new SourceRunStats(source);
        stats.skipped = true;
        stats.errorMessage = "Run aborted before source started";
        return stats;
    }

    public void recordFetch(SourceFetchResult result) {
        fetched += result.candidates().size();
        errors += result.errors();
        if (result.errorMessage() != null) {
            errorMessage = result.errorMessage();
        }
    }

    public void recordCreated() {
        created++;
    }

    public void recordUpdated() {
        updated++;
    }

    public void recordRejected() {
        rejected++;
    }

    public void recordError(String message) {
        errors++;
        if (message != null && errorMessage == null) {
            errorMessage = message;
        }
    }
}
