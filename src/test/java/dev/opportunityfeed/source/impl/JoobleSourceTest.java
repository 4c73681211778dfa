package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.metrics.IngestionMetrics;
import dev.opportunityfeed.model.CandidateOpportunity;
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

class JoobleSourceTest {

    private MockWebServer mockWebServer;
    private SourcesConfig sourcesConfig;
    private JoobleSource joobleSource;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        sourcesConfig = new SourcesConfig();
        sourcesConfig.setFetchTimeoutSeconds(5);
        sourcesConfig.getJooble().setBaseUrl(mockWebServer.url("/api/").toString());
        sourcesConfig.getJooble().setApiKey("secret-key");

        SourceHttpClient http = new SourceHttpClient(WebClient.builder(), sourcesConfig,
                new IngestionMetrics(new SimpleMeterRegistry()));
        joobleSource = new JoobleSource(http, sourcesConfig);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void shouldPostSearchAndMapJobs() throws Exception {
        String jsonResponse = """
                {
                  "totalCount": 2,
                  "jobs": [
                    {
                      "id": "-4711",
                      "title": "Junior Java Developer",
                      "company": "Initech",
                      "location": "Austin, TX",
                      "snippet": "<b>Java</b> and Spring",
                      "salary": "$80k",
                      "link": "https://jooble.org/desc/-4711",
                      "updated": "2025-03-01T00:00:00"
                    },
                    {
                      "id": "12",
                      "title": "Marketing Intern",
                      "company": "",
                      "location": "",
                      "snippet": "",
                      "link": "https://jooble.org/desc/12"
                    }
                  ]
                }
                """;
        mockWebServer.enqueue(new MockResponse()
                .setBody(jsonResponse)
                .addHeader("Content-Type", "application/json"));

        StepVerifier.create(joobleSource.fetch())
                .assertNext(result -> {
                    assertThat(result.errors()).isZero();
                    assertThat(result.candidates()).hasSize(2);

                    CandidateOpportunity java = result.candidates().get(0);
                    assertThat(java.getTitle()).isEqualTo("Junior Java Developer");
                    assertThat(java.getCompany()).isEqualTo("Initech");
                    assertThat(java.getDescription()).isEqualTo("Java and Spring");
                    assertThat(java.getSalary()).isEqualTo("$80k");
                    assertThat(java.getSourceId()).isEqualTo("-4711");
                    assertThat(java.getSource()).isEqualTo("jooble");
                    assertThat(java.getCategory()).isEqualTo("Technology");

                    CandidateOpportunity intern = result.candidates().get(1);
                    assertThat(intern.getCompany()).isEqualTo("Unknown Company");
                    assertThat(intern.getLocation()).isEqualTo("Unknown Location");
                    assertThat(intern.getDescription()).isEqualTo("Marketing Intern");
                })
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/secret-key");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("keywords").asText()).isEqualTo("internship OR job OR opportunity");
        assertThat(body.path("location").asText()).isEqualTo("United States");
    }

    @Test
    void shouldSkipWithoutApiKey() {
        sourcesConfig.getJooble().setApiKey(" ");

        StepVerifier.create(joobleSource.fetch())
                .assertNext(result -> {
                    assertThat(result.candidates()).isEmpty();
                    assertThat(result.errors()).isZero();
                })
                .verifyComplete();
        assertThat(mockWebServer.getRequestCount()).isZero();
    }
}
