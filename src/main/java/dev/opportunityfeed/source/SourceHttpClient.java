package dev.opportunityfeed.source;

import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.metrics.IngestionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * HTTP transport shared by all sources: browser-like headers, per-request timeout,
 * backoff on 429 and latency recorded per source.
 */
@Slf4j
@Component
public class SourceHttpClient {

    private final WebClient webClient;
    private final IngestionMetrics metrics;
    private final Duration timeout;

    public SourceHttpClient(WebClient.Builder webClientBuilder, SourcesConfig sourcesConfig, IngestionMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36")
                .defaultHeader("Accept", "application/json, application/rss+xml, application/atom+xml, text/xml, */*")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.timeout = Duration.ofSeconds(sourcesConfig.getFetchTimeoutSeconds());
    }

    /**
     * Execute a timed GET request.
     */
    public <T> Mono<T> get(String source, URI uri, Class<T> responseType) {
        return timed(source, webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(responseType));
    }

    /**
     * Execute a timed POST request with a JSON body.
     */
    public <T> Mono<T> post(String source, URI uri, Object body, Class<T> responseType) {
        return timed(source, webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType));
    }

    private <T> Mono<T> timed(String source, Mono<T> request) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return request
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(2, Duration.ofSeconds(2))
                            .filter(SourceHttpClient::isRateLimited)
                            .doBeforeRetry(signal -> log.debug("{} rate limited, retry #{}", source,
                                    signal.totalRetries() + 1))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .doOnTerminate(() -> metrics.recordFetchLatency(source,
                            System.currentTimeMillis() - start));
        });
    }

    static boolean isRateLimited(Throwable e) {
        return e instanceof WebClientResponseException responseException
                && responseException.getStatusCode().value() == 429;
    }
}
