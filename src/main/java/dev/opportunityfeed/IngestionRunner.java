package dev.opportunityfeed;

import dev.opportunityfeed.model.FetchRunStats;
import dev.opportunityfeed.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Blocking entry point to the ingestion pipeline, used by the command line run, the scheduler
 * and the HTTP trigger. Always returns a stats object.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionRunner {

  private static final String SEPARATOR = "========================================";

  private final IngestionService ingestionService;

  @Value("${ingestion.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Runs one ingestion and waits for it.
   *
   * @return the run's stats, flagged as failed if the run could not complete
   */
  public FetchRunStats runNow() {
    log.info(SEPARATOR);
    log.info("Opportunity Feed ingestion starting");
    log.info(SEPARATOR);

    try {
      FetchRunStats stats = ingestionService.runIngestion().block();
      if (stats == null) {
        stats = FetchRunStats.failed("Ingestion produced no result");
      }

      log.info(SEPARATOR);
      log.info("Ingestion {}", stats.isFailed() ? "failed: " + stats.getFailureMessage() : "completed");
      log.info("New: {}, updated: {}, errors: {}",
          stats.getTotalCreated(), stats.getTotalUpdated(), stats.getTotalErrors());
      log.info(SEPARATOR);

      return stats;
    } catch (Exception e) {
      log.error("Ingestion failed: {}", e.getMessage(), e);
      return FetchRunStats.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
  }

  public List<FetchRunStats> recentRuns(int limit) {
    return ingestionService.recentRuns(Math.max(0, limit));
  }

  public boolean abort() {
    return ingestionService.requestAbort();
  }

  /**
   * Keeps the process alive so a Prometheus scrape can collect the last run.
   */
  public void awaitMetricsScrape() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
