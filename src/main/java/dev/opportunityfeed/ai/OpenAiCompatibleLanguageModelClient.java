package dev.opportunityfeed.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.opportunityfeed.config.ClassificationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Any OpenAI-compatible {@code /chat/completions} endpoint (Groq, OpenRouter, a local vLLM...).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "classification.provider", havingValue = "openai")
public class OpenAiCompatibleLanguageModelClient implements LanguageModelClient {

    private static final String CHAT_PATH = "/chat/completions";

    private final WebClient webClient;
    private final String model;

    public OpenAiCompatibleLanguageModelClient(WebClient.Builder webClientBuilder, ClassificationConfig config) {
        this.model = config.getModel();
        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + config.getApiKey());
        } else {
            log.warn("No API key configured for the OpenAI-compatible classifier at {}", config.getBaseUrl());
        }
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> generate(String prompt) {
        ChatRequest request = new ChatRequest(model, List.of(new ChatRequest.Message("user", prompt)), 0.0, 256, false);

        return webClient.post()
                .uri(CHAT_PATH)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .flatMap(response -> {
                    String content = extractContent(response);
                    if (content == null || content.isBlank()) {
                        return Mono.error(new ClassifierException("Empty completion from " + CHAT_PATH));
                    }
                    return Mono.just(content);
                });
    }

    @Override
    public String getProviderName() {
        return "openai";
    }

    private String extractContent(ChatResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            return response.choices().get(0).message().content();
        }
        return null;
    }

    // DTOs
    record ChatRequest(String model, List<Message> messages, double temperature,
                       @JsonProperty("max_tokens") int maxTokens, boolean stream) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
