package com.flamingo.ai.digest.service.digest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.exception.StorageException;
import com.flamingo.ai.digest.service.ops.PipelineOperationsService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DigestScheduler Tests")
class DigestSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:17:42Z");

  @Mock private PipelineOperationsService operationsService;

  private PipelineConfig config;
  private DigestScheduler scheduler;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    config.getDigest().setChatId("@digest");
    scheduler = new DigestScheduler(operationsService, config, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Should pick the last completed aligned window")
  void shouldAlignWindow() {
    TimeWindow hourly = scheduler.lastCompletedWindow(NOW);
    assertThat(hourly.start()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
    assertThat(hourly.end()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));

    config.getDigest().setWindow(Duration.ofMinutes(15));
    TimeWindow quarter = scheduler.lastCompletedWindow(NOW);
    assertThat(quarter.start()).isEqualTo(Instant.parse("2026-03-01T09:45:00Z"));
    assertThat(quarter.end()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }

  @Test
  @DisplayName("Should treat a boundary instant as the end of the previous window")
  void shouldHandleBoundary() {
    TimeWindow window = scheduler.lastCompletedWindow(Instant.parse("2026-03-01T10:00:00Z"));

    assertThat(window.end()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }

  @Test
  @DisplayName("Should do nothing while disabled")
  void shouldStayIdleWhenDisabled() {
    scheduler.publishLastWindow();

    verifyNoInteractions(operationsService);
  }

  @Test
  @DisplayName("Should publish the last window to the configured chat")
  void shouldPublish() {
    config.getDigest().setSchedulerEnabled(true);
    TimeWindow expected =
        new TimeWindow(
            Instant.parse("2026-03-01T09:00:00Z"), Instant.parse("2026-03-01T10:00:00Z"));
    when(operationsService.publishDigest(expected, "@digest"))
        .thenReturn(new DigestRunResult(expected, DigestRunResult.Status.POSTED, null, 1, null));

    scheduler.publishLastWindow();

    verify(operationsService).publishDigest(expected, "@digest");
  }

  @Test
  @DisplayName("Should survive a storage outage")
  void shouldSurviveStorageFailure() {
    config.getDigest().setSchedulerEnabled(true);
    when(operationsService.publishDigest(any(), any()))
        .thenThrow(new StorageException("down", null, true));

    scheduler.publishLastWindow();

    verify(operationsService).publishDigest(any(), any());
  }
}
