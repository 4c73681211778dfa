package dev.opportunityfeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for the classification gate and the language-model endpoint behind it.
 * Loaded from application.yml under 'classification' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "classification")
public class ClassificationConfig {

    private boolean enabled = true;

    /**
     * ollama or openai (any OpenAI-compatible chat completions endpoint).
     */
    private String provider = "ollama";
    private String baseUrl = "http://localhost:11434";
    private String model = "llama2";
    private String apiKey = "";

    /**
     * Kept well above the fetch timeout: model cold starts are slow.
     */
    private int timeoutSeconds = 120;

    private double minConfidence = 0.7;
    private boolean rejectOnError = true;

    /**
     * Trusted sources admitted without classification. A trailing '*' matches by prefix.
     */
    private List<String> skipSources = new ArrayList<>();

    public boolean isSkipped(String source) {
        if (source == null) {
            return false;
        }
        String name = source.toLowerCase(Locale.ROOT);
        for (String entry : skipSources) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String pattern = entry.trim().toLowerCase(Locale.ROOT);
            if (pattern.endsWith("*")) {
                if (name.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (name.equals(pattern)) {
                return true;
            }
        }
        return false;
    }
}
