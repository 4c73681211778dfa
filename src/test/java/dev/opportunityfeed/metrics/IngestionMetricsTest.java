package dev.opportunityfeed.metrics;

import dev.opportunityfeed.model.ClassificationResult.Verdict;
import dev.opportunityfeed.model.FetchRunStats;
import dev.opportunityfeed.model.SourceFetchResult;
import dev.opportunityfeed.model.SourceRunStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionMetricsTest {

    private MeterRegistry meterRegistry;
    private IngestionMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new IngestionMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Run counters")
    class RunCountersTests {

        @Test
        @DisplayName("Should count started and failed runs")
        void shouldCountRuns() {
            metrics.recordRunStarted();
            metrics.recordRunStarted();
            metrics.recordRunFailed();

            assertThat(meterRegistry.counter("opportunity_feed_runs_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("opportunity_feed_run_failures_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Source counters")
    class SourceCountersTests {

        @Test
        @DisplayName("Should tag counters by source")
        void shouldTagBySource() {
            metrics.recordFetched("jooble", 10);
            metrics.recordFetched("jooble", 5);
            metrics.recordFetched("meetup", 1);
            metrics.recordCreated("jooble");
            metrics.recordUpdated("jooble");
            metrics.recordRejected("meetup");
            metrics.recordError("meetup");

            assertThat(meterRegistry.counter("opportunity_feed_candidates_fetched_total", "source", "jooble").count())
                    .isEqualTo(15.0);
            assertThat(meterRegistry.counter("opportunity_feed_candidates_fetched_total", "source", "meetup").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("opportunity_feed_opportunities_created_total", "source", "jooble").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("opportunity_feed_opportunities_updated_total", "source", "jooble").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("opportunity_feed_candidates_rejected_total", "source", "meetup").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("opportunity_feed_errors_total", "source", "meetup").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should count classifier verdicts")
        void shouldCountVerdicts() {
            metrics.recordVerdict(Verdict.ACCEPT);
            metrics.recordVerdict(Verdict.INDETERMINATE);
            metrics.recordVerdict(Verdict.INDETERMINATE);

            assertThat(meterRegistry.counter("opportunity_feed_classifier_verdicts_total", "verdict", "accept").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("opportunity_feed_classifier_verdicts_total", "verdict", "indeterminate")
                    .count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Timers and gauges")
    class TimersAndGaugesTests {

        @Test
        @DisplayName("Should reuse one timer per source")
        void shouldRecordFetchLatency() {
            metrics.recordFetchLatency("reddit_jobbit", 120);
            metrics.recordFetchLatency("reddit_jobbit", 80);

            Timer timer = metrics.getSourceTimer("reddit_jobbit");
            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        }

        @Test
        @DisplayName("Should expose last run totals")
        void shouldUpdateLastRunGauges() {
            SourceRunStats source = new SourceRunStats("jooble");
            source.recordFetch(SourceFetchResult.of("jooble", List.of(), 2));
            source.recordCreated();
            source.recordCreated();
            source.recordUpdated();
            FetchRunStats stats = FetchRunStats.start();
            stats.record(source);

            metrics.updateLastRunStats(stats);

            assertThat(meterRegistry.get("opportunity_feed_last_run_created").gauge().value()).isEqualTo(2.0);
            assertThat(meterRegistry.get("opportunity_feed_last_run_updated").gauge().value()).isEqualTo(1.0);
            assertThat(meterRegistry.get("opportunity_feed_last_run_errors").gauge().value()).isEqualTo(2.0);
            assertThat(meterRegistry.get("opportunity_feed_last_run_fetched").gauge().value()).isZero();
        }
    }
}
