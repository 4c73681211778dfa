package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jooble job search: keyed POST to {@code {base-url}/{api-key}}.
 */
@Slf4j
@Component
public class JoobleSource extends AbstractOpportunitySource<JoobleSource.JoobleJob> {

    public static final String NAME = "jooble";

    public JoobleSource(SourceHttpClient http, SourcesConfig sourcesConfig) {
        super(http, sourcesConfig);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        String apiKey = sourcesConfig.getJooble().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    protected URI getApiUrl() {
        SourcesConfig.Jooble jooble = sourcesConfig.getJooble();
        return UriComponentsBuilder.fromUriString(jooble.getBaseUrl())
                .pathSegment(jooble.getApiKey())
                .build()
                .toUri();
    }

    @Override
    protected Mono<List<JoobleJob>> fetchItems() {
        SourcesConfig.Jooble jooble = sourcesConfig.getJooble();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("keywords", jooble.getKeywords());
        payload.put("location", jooble.getLocation());
        payload.put("radius", "25");
        payload.put("page", 1);
        payload.put("searchMode", 1);

        return http.post(NAME, getApiUrl(), payload, JoobleResponse.class)
                .map(response -> response.getJobs() == null ? List.<JoobleJob>of() : response.getJobs());
    }

    @Override
    protected CandidateOpportunity toCandidate(JoobleJob job) {
        return CandidateOpportunity.builder()
                .title(job.getTitle())
                .company(OpportunityNormalizer.firstNonBlank(job.getCompany(), OpportunityNormalizer.UNKNOWN_COMPANY))
                .location(OpportunityNormalizer.firstNonBlank(job.getLocation(), "Unknown Location"))
                .description(job.getSnippet())
                .salary(OpportunityNormalizer.firstNonBlank(job.getSalary()))
                .applicationUrl(job.getLink())
                .sourceId(job.getId())
                .sourceUrl(job.getLink())
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JoobleResponse {
        private Integer totalCount;
        private List<JoobleJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JoobleJob {
        private String id;
        private String title;
        private String company;
        private String location;
        private String snippet;
        private String salary;
        private String link;
        private String updated;
    }
}
