package dev.opportunityfeed.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregated result of one ingestion run: per-source counters plus run-level totals.
 * Kept in memory only.
 */
@Getter
public class FetchRunStats {

    private final String runId;
    private final Instant startedAt;
    private Instant finishedAt;
    private boolean aborted;
    private String failureMessage;
    private final Map<String, SourceRunStats> sources = new LinkedHashMap<>();

    private FetchRunStats(String runId, Instant startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public static FetchRunStats start() {
        return new FetchRunStats(UUID.randomUUID().toString(), Instant.now());
    }

    /**
     * A run that could not execute at all. Still a valid stats object for the caller.
     */
    public static FetchRunStats failed(String message) {
        FetchRunStats stats = start();
        stats.failureMessage = message;
        stats.finishedAt = stats.startedAt;
        return stats;
    }

    public synchronized void record(SourceRunStats sourceStats) {
        sources.put(sourceStats.getSource(), sourceStats);
    }

    public synchronized FetchRunStats finish(boolean abortRequested) {
        this.aborted = abortRequested;
        this.finishedAt = Instant.now();
        return this;
    }

    public synchronized void markFailed(String message) {
        this.failureMessage = message;
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<SourceRunStats> getSources() {
        return new ArrayList<>(sources.values());
    }

    public synchronized SourceRunStats getSource(String name) {
        return sources.get(name);
    }

    public boolean isFailed() {
        return failureMessage != null;
    }

    public int getTotalFetched() {
        return getSources().stream().mapToInt(SourceRunStats::getFetched).sum();
    }

    public int getTotalCreated() {
        return getSources().stream().mapToInt(SourceRunStats::getCreated).sum();
    }

    public int getTotalUpdated() {
        return getSources().stream().mapToInt(SourceRunStats::getUpdated).sum();
    }

    public int getTotalRejected() {
        return getSources().stream().mapToInt(SourceRunStats::getRejected).sum();
    }

    public int getTotalErrors() {
        int errors = getSources().stream().mapToInt(SourceRunStats::getErrors).sum();
        return isFailed() ? errors + 1 : errors;
    }
}
