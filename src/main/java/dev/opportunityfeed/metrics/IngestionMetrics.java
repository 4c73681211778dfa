package dev.opportunityfeed.metrics;

import dev.opportunityfeed.model.ClassificationResult;
import dev.opportunityfeed.model.FetchRunStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for ingestion runs.
 */
@Component
public class IngestionMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    private final Counter runsCounter;
    private final Counter runFailuresCounter;

    // Timers (per source)
    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunFetched = new AtomicInteger(0);
    private final AtomicInteger lastRunCreated = new AtomicInteger(0);
    private final AtomicInteger lastRunUpdated = new AtomicInteger(0);
    private final AtomicInteger lastRunErrors = new AtomicInteger(0);

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runsCounter = Counter.builder("opportunity_feed_runs_total")
                .description("Total ingestion runs started")
                .register(registry);

        this.runFailuresCounter = Counter.builder("opportunity_feed_run_failures_total")
                .description("Ingestion runs that could not complete")
                .register(registry);

        Gauge.builder("opportunity_feed_last_run_fetched", lastRunFetched, AtomicInteger::get)
                .description("Candidates fetched in last run")
                .register(registry);

        Gauge.builder("opportunity_feed_last_run_created", lastRunCreated, AtomicInteger::get)
                .description("Opportunities created in last run")
                .register(registry);

        Gauge.builder("opportunity_feed_last_run_updated", lastRunUpdated, AtomicInteger::get)
                .description("Opportunities updated in last run")
                .register(registry);

        Gauge.builder("opportunity_feed_last_run_errors", lastRunErrors, AtomicInteger::get)
                .description("Errors in last run")
                .register(registry);
    }

    public Timer getSourceTimer(String sourceName) {
        return sourceTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("opportunity_feed_source_fetch_duration")
                        .description("Time to fetch candidates from source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordRunStarted() {
        runsCounter.increment();
    }

    public void recordRunFailed() {
        runFailuresCounter.increment();
    }

    public void recordFetched(String source, int count) {
        sourceCounter("opportunity_feed_candidates_fetched_total", source).increment(count);
    }

    public void recordCreated(String source) {
        sourceCounter("opportunity_feed_opportunities_created_total", source).increment();
    }

    public void recordUpdated(String source) {
        sourceCounter("opportunity_feed_opportunities_updated_total", source).increment();
    }

    public void recordRejected(String source) {
        sourceCounter("opportunity_feed_candidates_rejected_total", source).increment();
    }

    public void recordError(String source) {
        sourceCounter("opportunity_feed_errors_total", source).increment();
    }

    /**
     * Count a classifier outcome by verdict.
     */
    public void recordVerdict(ClassificationResult.Verdict verdict) {
        Counter.builder("opportunity_feed_classifier_verdicts_total")
                .tag("verdict", verdict.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }

    public void updateLastRunStats(FetchRunStats stats) {
        lastRunFetched.set(stats.getTotalFetched());
        lastRunCreated.set(stats.getTotalCreated());
        lastRunUpdated.set(stats.getTotalUpdated());
        lastRunErrors.set(stats.getTotalErrors());
    }

    private Counter sourceCounter(String name, String source) {
        return Counter.builder(name)
                .tag(TAG_SOURCE, source)
                .register(registry);
    }
}
