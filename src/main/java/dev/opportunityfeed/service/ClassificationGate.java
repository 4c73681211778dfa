package dev.opportunityfeed.service;

import dev.opportunityfeed.ai.OpportunityClassifier;
import dev.opportunityfeed.config.ClassificationConfig;
import dev.opportunityfeed.metrics.IngestionMetrics;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.ClassificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Admission policy between fetched candidates and storage.
 * Order: trusted source, classification switched off, empty title, classifier verdict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationGate {

    private final OpportunityClassifier classifier;
    private final KeywordFallbackFilter fallbackFilter;
    private final ClassificationConfig config;
    private final IngestionMetrics metrics;

    /**
     * Outcome of the gate for one candidate.
     */
    public record GateDecision(boolean admitted, String reason, ClassificationResult classification) {
        public static GateDecision admit(String reason) {
            return new GateDecision(true, reason, null);
        }

        public static GateDecision reject(String reason) {
            return new GateDecision(false, reason, null);
        }
    }

    public Mono<Boolean> shouldAdmit(CandidateOpportunity candidate) {
        return evaluate(candidate).map(GateDecision::admitted);
    }

    public Mono<GateDecision> evaluate(CandidateOpportunity candidate) {
        if (config.isSkipped(candidate.getSource())) {
            return Mono.just(GateDecision.admit("Trusted source " + candidate.getSource()));
        }
        if (!config.isEnabled()) {
            return Mono.just(GateDecision.admit("Classification disabled"));
        }
        if (!candidate.hasTitle()) {
            return Mono.just(GateDecision.reject("Empty title"));
        }

        return classifier.classify(candidate.getTitle(), candidate.getDescription(), candidate.getSource())
                .doOnNext(result -> metrics.recordVerdict(result.verdict()))
                .map(result -> decide(candidate, result));
    }

    private GateDecision decide(CandidateOpportunity candidate, ClassificationResult result) {
        return switch (result.verdict()) {
            case ACCEPT -> result.confidence() >= config.getMinConfidence()
                    ? new GateDecision(true, result.reasoning(), result)
                    : new GateDecision(false, "Low confidence accept: " + result.reasoning(), result);
            case REJECT -> new GateDecision(false, result.reasoning(), result);
            case INDETERMINATE -> onIndeterminate(candidate, result);
        };
    }

    private GateDecision onIndeterminate(CandidateOpportunity candidate, ClassificationResult result) {
        if (config.isRejectOnError()) {
            return new GateDecision(false, "Classifier unavailable (" + result.error() + "), rejecting", result);
        }
        boolean admitted = fallbackFilter.isLikelyOpportunity(candidate.getTitle(), candidate.getDescription());
        log.debug("Keyword fallback {} '{}'", admitted ? "admitted" : "rejected", candidate.getTitle());
        return new GateDecision(admitted, "Keyword fallback after: " + result.reasoning(), result);
    }
}
