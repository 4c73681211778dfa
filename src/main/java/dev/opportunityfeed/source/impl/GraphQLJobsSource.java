package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.SourceFetchException;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * GraphQL Jobs board. Public, no credentials.
 */
@Slf4j
@Component
public class GraphQLJobsSource extends AbstractOpportunitySource<GraphQLJobsSource.GraphQLJob> {

    public static final String NAME = "graphql_jobs";

    private static final String JOBS_QUERY = """
            {
              jobs {
                id
                title
                company { name }
                locationNames
                description
                applyUrl
                postedAt
                tags { name }
              }
            }
            """;

    public GraphQLJobsSource(SourceHttpClient http, SourcesConfig sourcesConfig) {
        super(http, sourcesConfig);
    }

    @Override
    public String getName() {
        return NAME;
    }

    protected URI getApiUrl() {
        return URI.create(sourcesConfig.getGraphqlJobs().getUrl());
    }

    @Override
    protected Mono<List<GraphQLJob>> fetchItems() {
        return http.post(NAME, getApiUrl(), Map.of("query", JOBS_QUERY), GraphQLResponse.class)
                .flatMap(response -> {
                    if (response.getErrors() != null && !response.getErrors().isEmpty()) {
                        return Mono.error(new SourceFetchException("GraphQL errors: " + response.getErrors()));
                    }
                    if (response.getData() == null || response.getData().getJobs() == null) {
                        return Mono.just(List.<GraphQLJob>of());
                    }
                    return Mono.just(response.getData().getJobs());
                });
    }

    @Override
    protected CandidateOpportunity toCandidate(GraphQLJob job) {
        String company = job.getCompany() != null ? job.getCompany().getName() : null;
        String location = job.getLocationNames() == null || job.getLocationNames().isEmpty()
                ? OpportunityNormalizer.DEFAULT_LOCATION
                : String.join(", ", job.getLocationNames());
        String category = job.getTags() == null || job.getTags().isEmpty()
                ? "Technology"
                : OpportunityNormalizer.firstNonBlank(job.getTags().get(0).getName(), "Technology");

        return CandidateOpportunity.builder()
                .title(job.getTitle())
                .company(OpportunityNormalizer.firstNonBlank(company, OpportunityNormalizer.UNKNOWN_COMPANY))
                .location(location)
                .type(OpportunityType.JOB)
                .category(category)
                .description(job.getDescription())
                .applicationUrl(job.getApplyUrl())
                .sourceId(job.getId())
                .sourceUrl(job.getApplyUrl())
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GraphQLResponse {
        private GraphQLData data;
        private List<JsonNode> errors;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GraphQLData {
        private List<GraphQLJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GraphQLJob {
        private String id;
        private String title;
        private NamedRef company;
        private List<String> locationNames;
        private String description;
        private String applyUrl;
        private String postedAt;
        private List<NamedRef> tags;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NamedRef {
        private String name;
    }
}
