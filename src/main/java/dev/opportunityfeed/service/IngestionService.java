package dev.opportunityfeed.service;

import dev.opportunityfeed.config.IngestionConfig;
import dev.opportunityfeed.metrics.IngestionMetrics;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.FetchRunStats;
import dev.opportunityfeed.model.SourceFetchResult;
import dev.opportunityfeed.model.SourceRunStats;
import dev.opportunityfeed.source.OpportunitySource;
import dev.opportunityfeed.source.SourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every enabled source through fetch, gate and dedup, and aggregates the run's stats.
 * Sources run concurrently up to {@code ingestion.concurrency}; candidates of one source run
 * in order. Failures are counted per candidate and per source and never fail the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private static final String SEPARATOR = "========================================";
    static final String ALREADY_RUNNING = "Ingestion run already in progress";

    private final SourceRegistry sourceRegistry;
    private final ClassificationGate classificationGate;
    private final DeduplicationService deduplicationService;
    private final FetchRunLog runLog;
    private final IngestionMetrics metrics;
    private final IngestionConfig config;

    private final AtomicReference<String> activeRunId = new AtomicReference<>();
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    /**
     * Execute one ingestion run.
     *
     * @return Mono with the run's stats; a second call while a run is active completes
     *         immediately with a failed stats object
     */
    public Mono<FetchRunStats> runIngestion() {
        return Mono.defer(() -> {
            FetchRunStats stats = FetchRunStats.start();
            if (!activeRunId.compareAndSet(null, stats.getRunId())) {
                log.warn(ALREADY_RUNNING);
                return Mono.just(FetchRunStats.failed(ALREADY_RUNNING));
            }
            abortRequested.set(false);

            List<OpportunitySource> sources = sourceRegistry.getEnabledSources();

            log.info(SEPARATOR);
            log.info("Ingestion run {} starting", stats.getRunId());
            log.info(SEPARATOR);
            log.info("Sources enabled: {}", sources.size());
            metrics.recordRunStarted();

            return Flux.fromIterable(sources)
                    .flatMap(this::runSource, Math.max(1, config.getConcurrency()))
                    .doOnNext(stats::record)
                    .then(Mono.fromCallable(() -> stats.finish(abortRequested.get())))
                    .onErrorResume(e -> {
                        log.error("Ingestion run {} failed: {}", stats.getRunId(), e.getMessage(), e);
                        stats.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                        metrics.recordRunFailed();
                        return Mono.just(stats.finish(abortRequested.get()));
                    })
                    .doOnNext(this::complete)
                    .doFinally(signal -> release(stats));
        });
    }

    /**
     * Ask the active run to stop before its next source. Sources already started finish.
     *
     * @return true if a run was active
     */
    public boolean requestAbort() {
        if (activeRunId.get() == null) {
            return false;
        }
        log.info("Abort requested; remaining sources will be skipped");
        abortRequested.set(true);
        return true;
    }

    public boolean isRunning() {
        return activeRunId.get() != null;
    }

    public List<FetchRunStats> recentRuns(int limit) {
        return runLog.recent(limit);
    }

    private Mono<SourceRunStats> runSource(OpportunitySource source) {
        String name = source.getName();
        return Mono.defer(() -> {
            if (abortRequested.get()) {
                log.info("Skipping {}: run aborted", name);
                return Mono.just(SourceRunStats.skipped(name));
            }
            SourceRunStats sourceStats = new SourceRunStats(name);

            return Mono.defer(source::fetch)
                    .onErrorResume(e -> Mono.just(SourceFetchResult.failed(name, 1, e.getMessage())))
                    .defaultIfEmpty(SourceFetchResult.failed(name, 1, "Source completed without a result"))
                    .doOnNext(result -> recordFetch(sourceStats, result))
                    .flatMapMany(result -> Flux.fromIterable(result.candidates()))
                    .concatMap(candidate -> processCandidate(candidate, sourceStats))
                    .then(Mono.just(sourceStats))
                    .onErrorResume(e -> {
                        log.warn("{} pipeline failed: {}", name, e.getMessage());
                        sourceStats.recordError(e.getMessage());
                        metrics.recordError(name);
                        return Mono.just(sourceStats);
                    })
                    .doOnNext(this::logSourceSummary);
        });
    }

    private void recordFetch(SourceRunStats sourceStats, SourceFetchResult result) {
        sourceStats.recordFetch(result);
        metrics.recordFetched(result.source(), result.candidates().size());
        for (int i = 0; i < result.errors(); i++) {
            metrics.recordError(result.source());
        }
    }

    private Mono<Void> processCandidate(CandidateOpportunity candidate, SourceRunStats sourceStats) {
        String source = sourceStats.getSource();
        return classificationGate.evaluate(candidate)
                .flatMap(decision -> {
                    if (!decision.admitted()) {
                        log.debug("[{}] rejected '{}': {}", source, candidate.getTitle(), decision.reason());
                        sourceStats.recordRejected();
                        metrics.recordRejected(source);
                        return Mono.<Void>empty();
                    }
                    return Mono.fromCallable(() -> deduplicationService.upsert(candidate))
                            .subscribeOn(Schedulers.boundedElastic())
                            .doOnNext(result -> {
                                if (result.isNew()) {
                                    log.debug("[{}] created '{}'", source, candidate.getTitle());
                                    sourceStats.recordCreated();
                                    metrics.recordCreated(source);
                                } else {
                                    log.debug("[{}] updated '{}'", source, candidate.getTitle());
                                    sourceStats.recordUpdated();
                                    metrics.recordUpdated(source);
                                }
                            })
                            .then();
                })
                .onErrorResume(e -> {
                    log.warn("[{}] failed to store '{}': {}", source, candidate.getTitle(), e.getMessage());
                    sourceStats.recordError(e.getMessage());
                    metrics.recordError(source);
                    return Mono.empty();
                });
    }

    private void logSourceSummary(SourceRunStats s) {
        if (s.isSkipped()) {
            return;
        }
        log.info("{}: fetched={}, new={}, updated={}, rejected={}, errors={}{}",
                s.getSource(), s.getFetched(), s.getCreated(), s.getUpdated(), s.getRejected(), s.getErrors(),
                s.getErrorMessage() != null ? " (" + s.getErrorMessage() + ")" : "");
    }

    /**
     * Clears the active-run marker only if it still belongs to this run.
     */
    private void release(FetchRunStats stats) {
        activeRunId.compareAndSet(stats.getRunId(), null);
    }

    private void complete(FetchRunStats stats) {
        runLog.append(stats);
        metrics.updateLastRunStats(stats);
        // released before the stats reach the caller so a follow-up run is accepted
        release(stats);

        log.info(SEPARATOR);
        log.info("INGESTION SUMMARY{}", stats.isAborted() ? " (aborted)" : "");
        log.info("Fetched: {} | New: {} | Updated: {} | Rejected: {} | Errors: {}",
                stats.getTotalFetched(), stats.getTotalCreated(), stats.getTotalUpdated(),
                stats.getTotalRejected(), stats.getTotalErrors());
        log.info(SEPARATOR);
    }
}
