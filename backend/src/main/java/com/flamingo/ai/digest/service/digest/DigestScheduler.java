package com.flamingo.ai.digest.service.digest;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.exception.StorageException;
import com.flamingo.ai.digest.service.ops.PipelineOperationsService;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes the most recent completed window. Windows are aligned to multiples of {@code
 * pipeline.digest.window} since the epoch; a window is attempted again on every tick until it is
 * posted or its failure is still within the retry grace interval.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DigestScheduler {

  private final PipelineOperationsService operationsService;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  @Scheduled(
      fixedDelayString = "${pipeline.digest.scheduler-interval:5m}",
      initialDelayString = "${pipeline.digest.scheduler-interval:5m}")
  public void publishLastWindow() {
    PipelineConfig.Digest digest = pipelineConfig.getDigest();
    if (!digest.isSchedulerEnabled()) {
      return;
    }
    TimeWindow window = lastCompletedWindow(clock.instant());
    try {
      DigestRunResult result = operationsService.publishDigest(window, digest.getChatId());
      log.debug("Scheduled digest for window {}: {}", window, result.status());
    } catch (StorageException e) {
      log.warn("Scheduled digest for window {} failed: {}", window, e.getMessage());
    }
  }

  TimeWindow lastCompletedWindow(Instant now) {
    long size = pipelineConfig.getDigest().getWindow().toMillis();
    long end = Math.floorDiv(now.toEpochMilli(), size) * size;
    return new TimeWindow(Instant.ofEpochMilli(end - size), Instant.ofEpochMilli(end));
  }
}
