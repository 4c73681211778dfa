package dev.opportunityfeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the ingestion run itself and for deduplication.
 * Loaded from application.yml under 'ingestion' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionConfig {

    /**
     * Sources fetched in parallel.
     */
    private int concurrency = 3;
    private int runLogCapacity = 50;
    private int intervalHours = 24;
    private boolean scheduleEnabled = false;
    private boolean runOnStartup = true;
    private boolean exitAfterRun = true;

    private Dedup dedup = new Dedup();

    @Data
    public static class Dedup {
        private double similarityThreshold = 0.85;

        /**
         * levenshtein or token-overlap.
         */
        private String similarityStrategy = "levenshtein";
    }
}
