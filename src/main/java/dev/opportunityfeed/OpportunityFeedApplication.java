package dev.opportunityfeed;

import dev.opportunityfeed.config.IngestionConfig;
import dev.opportunityfeed.model.FetchRunStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class OpportunityFeedApplication implements CommandLineRunner {

    private final IngestionRunner ingestionRunner;
    private final ExitManager exitManager;
    private final IngestionConfig ingestionConfig;

    public static void main(String[] args) {
        SpringApplication.run(OpportunityFeedApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!ingestionConfig.isRunOnStartup()) {
            log.info("Startup ingestion disabled; waiting for trigger");
            return;
        }

        FetchRunStats stats = ingestionRunner.runNow();
        boolean failed = stats == null || stats.isFailed();

        if (ingestionConfig.isExitAfterRun()) {
            ingestionRunner.awaitMetricsScrape();
            log.info("Opportunity Feed exiting...");
            exitManager.exit(failed ? 1 : 0);
        }
    }
}
