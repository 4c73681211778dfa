package dev.opportunityfeed.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.opportunityfeed.config.ClassificationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Ollama {@code /api/generate} endpoint with streaming off.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "classification.provider", havingValue = "ollama", matchIfMissing = true)
public class OllamaLanguageModelClient implements LanguageModelClient {

    private static final String GENERATE_PATH = "/api/generate";

    private final WebClient webClient;
    private final String model;

    public OllamaLanguageModelClient(WebClient.Builder webClientBuilder, ClassificationConfig config) {
        this.model = config.getModel();
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build();
        log.info("Ollama classifier configured at {} with model {}", config.getBaseUrl(), model);
    }

    @Override
    public Mono<String> generate(String prompt) {
        return webClient.post()
                .uri(GENERATE_PATH)
                .bodyValue(new OllamaRequest(model, prompt, false))
                .retrieve()
                .bodyToMono(OllamaResponse.class)
                .flatMap(response -> {
                    if (response.response() == null || response.response().isBlank()) {
                        return Mono.error(new ClassifierException("Empty response from Ollama"));
                    }
                    return Mono.just(response.response());
                });
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    // DTOs
    record OllamaRequest(String model, String prompt, boolean stream) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OllamaResponse(String model, String response, Boolean done) {
    }
}
