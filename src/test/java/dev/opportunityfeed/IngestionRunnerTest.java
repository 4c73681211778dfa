package dev.opportunityfeed;

import dev.opportunityfeed.model.FetchRunStats;
import dev.opportunityfeed.service.IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionRunnerTest {

  @Mock
  private IngestionService ingestionService;

  @InjectMocks
  private IngestionRunner ingestionRunner;

  @BeforeEach
  @SuppressWarnings("null")
  void setUp() {
    ReflectionTestUtils.setField(ingestionRunner, "metricsWaitSeconds", 0);
  }

  @Test
  void runNow_successfulRun_returnsStats() {
    // Arrange
    FetchRunStats stats = FetchRunStats.start().finish(false);
    when(ingestionService.runIngestion()).thenReturn(Mono.just(stats));

    // Act
    FetchRunStats result = ingestionRunner.runNow();

    // Assert
    assertSame(stats, result);
    assertFalse(result.isFailed());
    verify(ingestionService).runIngestion();
  }

  @Test
  void runNow_emptyResult_returnsFailedStats() {
    // Arrange
    when(ingestionService.runIngestion()).thenReturn(Mono.empty());

    // Act
    FetchRunStats result = ingestionRunner.runNow();

    // Assert
    assertTrue(result.isFailed());
    assertEquals("Ingestion produced no result", result.getFailureMessage());
  }

  @Test
  void runNow_pipelineError_returnsFailedStats() {
    // Arrange
    when(ingestionService.runIngestion()).thenReturn(Mono.error(new RuntimeException("database is locked")));

    // Act
    FetchRunStats result = ingestionRunner.runNow();

    // Assert
    assertTrue(result.isFailed());
    assertEquals("database is locked", result.getFailureMessage());
    assertEquals(1, result.getTotalErrors());
  }

  @Test
  void recentRuns_negativeLimit_isClampedToZero() {
    when(ingestionService.recentRuns(0)).thenReturn(List.of());

    assertTrue(ingestionRunner.recentRuns(-5).isEmpty());
    verify(ingestionService).recentRuns(0);
  }

  @Test
  void abort_delegatesToService() {
    when(ingestionService.requestAbort()).thenReturn(true);

    assertTrue(ingestionRunner.abort());
  }

  @Test
  void awaitMetricsScrape_noWait_returnsImmediately() {
    ingestionRunner.awaitMetricsScrape();

    verifyNoInteractions(ingestionService);
  }
}
