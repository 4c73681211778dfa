package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.metrics.IngestionMetrics;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.source.SourceHttpClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GraphQLJobsSourceTest {

    private MockWebServer mockWebServer;
    private GraphQLJobsSource source;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        SourcesConfig sourcesConfig = new SourcesConfig();
        sourcesConfig.setFetchTimeoutSeconds(5);
        sourcesConfig.getGraphqlJobs().setUrl(mockWebServer.url("/graphql").toString());

        SourceHttpClient http = new SourceHttpClient(WebClient.builder(), sourcesConfig,
                new IngestionMetrics(new SimpleMeterRegistry()));
        source = new GraphQLJobsSource(http, sourcesConfig);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private void enqueueJson(String json) {
        mockWebServer.enqueue(new MockResponse()
                .setBody(json)
                .addHeader("Content-Type", "application/json"));
    }

    @Test
    void shouldQueryAndMapJobs() throws Exception {
        enqueueJson("""
                {
                  "data": {
                    "jobs": [
                      {
                        "id": "cjz1",
                        "title": "GraphQL Backend Engineer",
                        "company": {"name": "Apollo"},
                        "locationNames": ["Berlin", "Remote"],
                        "description": "Build the schema",
                        "applyUrl": "https://graphql.jobs/apply/cjz1",
                        "tags": [{"name": "Node"}, {"name": "GraphQL"}]
                      },
                      {
                        "id": "cjz2",
                        "title": "Platform Engineer",
                        "company": null,
                        "locationNames": [],
                        "tags": []
                      }
                    ]
                  }
                }
                """);

        StepVerifier.create(source.fetch())
                .assertNext(result -> {
                    assertThat(result.errors()).isZero();
                    assertThat(result.candidates()).hasSize(2);

                    CandidateOpportunity first = result.candidates().get(0);
                    assertThat(first.getCompany()).isEqualTo("Apollo");
                    assertThat(first.getLocation()).isEqualTo("Berlin, Remote");
                    assertThat(first.getCategory()).isEqualTo("Node");
                    assertThat(first.getType()).isEqualTo(OpportunityType.JOB);
                    assertThat(first.getSourceId()).isEqualTo("cjz1");

                    CandidateOpportunity second = result.candidates().get(1);
                    assertThat(second.getCompany()).isEqualTo("Unknown Company");
                    assertThat(second.getLocation()).isEqualTo("Remote");
                    assertThat(second.getCategory()).isEqualTo("Technology");
                })
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(new ObjectMapper().readTree(request.getBody().readUtf8()).path("query").asText())
                .contains("jobs")
                .contains("applyUrl");
    }

    @Test
    void shouldTreatGraphQLErrorsAsSourceError() {
        enqueueJson("""
                {"data": null, "errors": [{"message": "Cannot query field \\"jobs\\""}]}
                """);

        StepVerifier.create(source.fetch())
                .assertNext(result -> {
                    assertThat(result.candidates()).isEmpty();
                    assertThat(result.errors()).isEqualTo(1);
                    assertThat(result.errorMessage()).startsWith("GraphQL errors");
                })
                .verifyComplete();
    }
}
