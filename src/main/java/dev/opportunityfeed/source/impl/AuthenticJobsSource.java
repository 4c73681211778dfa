package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Authentic Jobs search API. The {@code listings.listing} node is a list, or a single object
 * when there is exactly one result.
 */
@Slf4j
@Component
public class AuthenticJobsSource extends AbstractOpportunitySource<JsonNode> {

    public static final String NAME = "authentic_jobs";

    public AuthenticJobsSource(SourceHttpClient http, SourcesConfig sourcesConfig) {
        super(http, sourcesConfig);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        String apiKey = sourcesConfig.getAuthenticJobs().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    protected URI getApiUrl() {
        SourcesConfig.AuthenticJobs config = sourcesConfig.getAuthenticJobs();
        return UriComponentsBuilder.fromUriString(config.getBaseUrl())
                .queryParam("api_key", config.getApiKey())
                .queryParam("method", "aj.jobs.search")
                .queryParam("format", "json")
                .queryParam("perpage", 100)
                .encode()
                .build()
                .toUri();
    }

    @Override
    protected Mono<List<JsonNode>> fetchItems() {
        return http.get(NAME, getApiUrl(), JsonNode.class)
                .map(AuthenticJobsSource::listings);
    }

    static List<JsonNode> listings(JsonNode response) {
        JsonNode listing = response.path("listings").path("listing");
        List<JsonNode> items = new ArrayList<>();
        if (listing.isArray()) {
            listing.forEach(items::add);
        } else if (listing.isObject()) {
            items.add(listing);
        }
        return items;
    }

    @Override
    protected CandidateOpportunity toCandidate(JsonNode listing) {
        String type = named(listing.path("type"), null);
        String url = textOrNull(listing.path("url"));
        String id = listing.path("id").isMissingNode() || listing.path("id").isNull()
                ? null : listing.path("id").asText();

        return CandidateOpportunity.builder()
                .title(textOrNull(listing.path("title")))
                .company(named(listing.path("company"), OpportunityNormalizer.UNKNOWN_COMPANY))
                .location(named(listing.path("location"), OpportunityNormalizer.DEFAULT_LOCATION))
                .type(OpportunityType.fromValue(type).orElse(OpportunityType.JOB))
                .category(named(listing.path("category"), "Technology"))
                .description(textOrNull(listing.path("description")))
                .applicationUrl(url)
                .sourceId(id)
                .sourceUrl(url)
                .build();
    }

    /**
     * {@code {"name": ...}} objects, or plain strings.
     */
    private static String named(JsonNode node, String fallback) {
        if (node.isObject()) {
            String name = textOrNull(node.path("name"));
            return name != null ? name : fallback;
        }
        String value = textOrNull(node);
        return value != null ? value : fallback;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
