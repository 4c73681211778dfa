package dev.opportunityfeed.ai;

import reactor.core.publisher.Mono;

/**
 * A single-shot text generation endpoint. One prompt in, one complete (non-streamed) answer out.
 */
public interface LanguageModelClient {

    /**
     * Generate a completion for the prompt.
     *
     * @param prompt full prompt text
     * @return Mono with the raw answer text; errors with {@link ClassifierException} when the
     *         endpoint answers with an empty or malformed envelope
     */
    Mono<String> generate(String prompt);

    /**
     * Provider name for logs.
     */
    String getProviderName();
}
