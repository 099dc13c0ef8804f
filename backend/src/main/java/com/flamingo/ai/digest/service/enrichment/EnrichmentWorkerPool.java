package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.exception.StorageException;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs N claim loops. Each loop claims a batch, processes it with bounded fan-out and sleeps when
 * nothing is claimable. Stuck claims are cleared on a fixed schedule.
 */
@Service
@Slf4j
public class EnrichmentWorkerPool {

  private final StorageGateway storageGateway;
  private final MessageProcessor messageProcessor;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final ThreadPoolTaskExecutor workerExecutor;
  private final ThreadPoolTaskExecutor taskExecutor;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicInteger activeWorkers = new AtomicInteger();

  public EnrichmentWorkerPool(
      StorageGateway storageGateway,
      MessageProcessor messageProcessor,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry,
      @Qualifier("enrichmentWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
      @Qualifier("enrichmentTaskExecutor") ThreadPoolTaskExecutor taskExecutor) {
    this.storageGateway = storageGateway;
    this.messageProcessor = messageProcessor;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.workerExecutor = workerExecutor;
    this.taskExecutor = taskExecutor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (pipelineConfig.getWorker().isEnabled()) {
      start();
    } else {
      log.info("Enrichment worker pool disabled");
    }
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    int workers = pipelineConfig.getWorker().getWorkers();
    log.info(
        "Starting {} enrichment workers (batch {}, fan-out {})",
        workers,
        pipelineConfig.getWorker().getBatchSize(),
        pipelineConfig.getWorker().getFanOut());
    for (int i = 0; i < workers; i++) {
      int workerId = i;
      workerExecutor.execute(() -> runLoop(workerId));
    }
  }

  @PreDestroy
  public void stop() {
    if (running.compareAndSet(true, false)) {
      log.info("Stopping enrichment workers");
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public int getActiveWorkers() {
    return activeWorkers.get();
  }

  void runLoop(int workerId) {
    activeWorkers.incrementAndGet();
    log.debug("Enrichment worker {} started", workerId);
    try {
      while (running.get()) {
        int claimed;
        try {
          claimed = runOnce();
        } catch (StorageException e) {
          log.warn("Worker {} could not claim messages: {}", workerId, e.getMessage());
          claimed = 0;
        }
        if (claimed == 0 && !sleep(pipelineConfig.getWorker().getIdleBackoff())) {
          break;
        }
      }
    } finally {
      activeWorkers.decrementAndGet();
      log.debug("Enrichment worker {} stopped", workerId);
    }
  }

  /**
   * Claims one batch and processes it.
   *
   * @return the number of claimed messages
   */
  public int runOnce() {
    PipelineConfig.Worker worker = pipelineConfig.getWorker();
    List<ClaimedMessage> claims = storageGateway.claimPendingBatch(worker.getBatchSize());
    if (claims.isEmpty()) {
      return 0;
    }
    log.debug("Claimed {} messages", claims.size());

    int fanOut = Math.max(1, worker.getFanOut());
    for (int from = 0; from < claims.size(); from += fanOut) {
      List<CompletableFuture<Void>> inFlight = new ArrayList<>(fanOut);
      for (ClaimedMessage claim : claims.subList(from, Math.min(from + fanOut, claims.size()))) {
        inFlight.add(CompletableFuture.runAsync(() -> processClaim(claim), taskExecutor));
      }
      CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
    }
    return claims.size();
  }

  /** Clears claims older than {@code pipeline.worker.stale-claim-after}. */
  @Scheduled(
      fixedDelayString = "${pipeline.worker.recovery-interval:1m}",
      initialDelayString = "${pipeline.worker.recovery-interval:1m}")
  public void recoverStuckClaims() {
    if (!pipelineConfig.getWorker().isEnabled()) {
      return;
    }
    try {
      int recovered =
          storageGateway.recoverStuckClaims(pipelineConfig.getWorker().getStaleClaimAfter());
      if (recovered > 0) {
        log.warn("Recovered {} stuck claims", recovered);
        meterRegistry.counter("claims.recovered").increment(recovered);
      }
    } catch (StorageException e) {
      log.warn("Stuck claim recovery failed: {}", e.getMessage());
    }
  }

  private void processClaim(ClaimedMessage claim) {
    try {
      ProcessingOutcome outcome = messageProcessor.process(claim);
      log.debug("Message {} -> {}", claim.rawMessageId(), outcome);
    } catch (StorageException e) {
      log.warn(
          "Storage failure while processing message {}: {}",
          claim.rawMessageId(),
          e.getMessage());
      releaseQuietly(claim);
    } catch (RuntimeException e) {
      log.error("Unexpected failure while processing message {}", claim.rawMessageId(), e);
      releaseQuietly(claim);
    }
  }

  private void releaseQuietly(ClaimedMessage claim) {
    try {
      storageGateway.releaseClaim(claim.rawMessageId());
    } catch (StorageException e) {
      log.warn(
          "Could not release claim on {}, leaving it to stuck-claim recovery: {}",
          claim.rawMessageId(),
          e.getMessage());
    }
  }

  private boolean sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.set(false);
      return false;
    }
  }
}
