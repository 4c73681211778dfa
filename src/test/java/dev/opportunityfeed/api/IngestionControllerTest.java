package dev.opportunityfeed.api;

import dev.opportunityfeed.IngestionRunner;
import dev.opportunityfeed.model.FetchRunStats;
import dev.opportunityfeed.model.SourceFetchResult;
import dev.opportunityfeed.model.SourceRunStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    @Mock
    private IngestionRunner ingestionRunner;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new IngestionController(ingestionRunner)).build();
    }

    @Test
    void shouldRunIngestionAndReturnStats() {
        SourceRunStats jooble = new SourceRunStats("jooble");
        jooble.recordFetch(SourceFetchResult.of("jooble", List.of(), 0));
        jooble.recordCreated();
        FetchRunStats stats = FetchRunStats.start();
        stats.record(jooble);
        stats.finish(false);
        when(ingestionRunner.runNow()).thenReturn(stats);

        webTestClient.post().uri("/api/ingestion/run")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runId").isEqualTo(stats.getRunId())
                .jsonPath("$.failed").isEqualTo(false)
                .jsonPath("$.totalCreated").isEqualTo(1)
                .jsonPath("$.sources[0].source").isEqualTo("jooble");
    }

    @Test
    void shouldCapLogLimit() {
        when(ingestionRunner.recentRuns(IngestionController.MAX_LOG_LIMIT)).thenReturn(List.of());

        webTestClient.get().uri("/api/ingestion/logs?limit=10000")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("[]");

        verify(ingestionRunner).recentRuns(IngestionController.MAX_LOG_LIMIT);
    }

    @Test
    void shouldReturnRecentRuns() {
        FetchRunStats failed = FetchRunStats.failed("Ingestion run already in progress");
        when(ingestionRunner.recentRuns(50)).thenReturn(List.of(failed));

        webTestClient.get().uri("/api/ingestion/logs")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].failureMessage").isEqualTo("Ingestion run already in progress");
    }

    @Test
    void shouldAcceptAbortOfActiveRun() {
        when(ingestionRunner.abort()).thenReturn(true);

        webTestClient.post().uri("/api/ingestion/abort")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.aborting").isEqualTo(true);
    }

    @Test
    void shouldRejectAbortWhenIdle() {
        when(ingestionRunner.abort()).thenReturn(false);

        webTestClient.post().uri("/api/ingestion/abort")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.aborting").isEqualTo(false);
    }
}
