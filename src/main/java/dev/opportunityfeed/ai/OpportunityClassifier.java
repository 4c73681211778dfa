package dev.opportunityfeed.ai;

import dev.opportunityfeed.config.ClassificationConfig;
import dev.opportunityfeed.model.ClassificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Asks the configured language model whether a post is a genuine opportunity.
 * Never errors: unreachable or unusable endpoints yield an indeterminate result.
 */
@Slf4j
@Service
public class OpportunityClassifier {

    private final LanguageModelClient client;
    private final ClassificationConfig config;

    public OpportunityClassifier(LanguageModelClient client, ClassificationConfig config) {
        this.client = client;
        this.config = config;
        log.info("Opportunity classifier using provider '{}' (enabled={}, timeout={}s, min confidence={})",
                client.getProviderName(), config.isEnabled(), config.getTimeoutSeconds(), config.getMinConfidence());
    }

    public Mono<ClassificationResult> classify(String title, String description, String source) {
        if (!config.isEnabled()) {
            return Mono.just(ClassificationResult.indeterminate("Classification disabled", "Classification is disabled"));
        }
        if (title == null || title.isBlank()) {
            return Mono.just(ClassificationResult.reject(1.0, "Empty title - not an opportunity"));
        }

        String prompt = ClassificationPromptBuilder.build(title, description, source);
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());

        return Mono.defer(() -> client.generate(prompt))
                .switchIfEmpty(Mono.error(() -> new ClassifierException("Empty response from " + client.getProviderName())))
                .timeout(timeout)
                .map(ClassificationResponseParser::parse)
                .map(this::applyConfidenceFloor)
                .doOnNext(result -> log.debug("Classified '{}' as {} ({}): {}", title, result.verdict(),
                        result.confidence(), result.reasoning()))
                .onErrorResume(e -> Mono.just(failure(e, timeout)));
    }

    /**
     * An accept below the minimum confidence is not an accept.
     */
    ClassificationResult applyConfidenceFloor(ClassificationResult result) {
        if (result.isAccepted() && result.confidence() < config.getMinConfidence()) {
            return ClassificationResult.reject(result.confidence(),
                    String.format("Confidence %.2f below minimum %.2f: %s",
                            result.confidence(), config.getMinConfidence(), result.reasoning()));
        }
        return result;
    }

    private ClassificationResult failure(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            log.warn("Classifier timed out after {}s", timeout.toSeconds());
            return ClassificationResult.indeterminate("Classification timed out",
                    "Request timed out after " + timeout.toSeconds() + " seconds");
        }
        if (e instanceof WebClientRequestException) {
            log.warn("Cannot reach {} classifier: {}", client.getProviderName(), e.getMessage());
            return ClassificationResult.indeterminate("Cannot reach classifier endpoint", e.getMessage());
        }
        if (e instanceof WebClientResponseException responseException) {
            log.warn("{} classifier answered {}", client.getProviderName(), responseException.getStatusCode());
            return ClassificationResult.indeterminate("Classifier endpoint error",
                    "HTTP " + responseException.getStatusCode().value());
        }
        log.warn("Classification failed: {}", e.getMessage());
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ClassificationResult.indeterminate("Classification error: " + message, message);
    }
}
