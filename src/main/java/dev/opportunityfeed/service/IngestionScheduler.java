package dev.opportunityfeed.service;

import dev.opportunityfeed.IngestionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic ingestion for long-running deployments, every {@code ingestion.interval-hours}.
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ingestion.schedule-enabled", havingValue = "true")
public class IngestionScheduler {

    private final IngestionRunner ingestionRunner;

    @Scheduled(fixedDelayString = "#{${ingestion.interval-hours:24} * 3600000}",
            initialDelayString = "#{${ingestion.interval-hours:24} * 3600000}")
    public void scheduledRun() {
        log.info("Scheduled ingestion triggered");
        ingestionRunner.runNow();
    }
}
