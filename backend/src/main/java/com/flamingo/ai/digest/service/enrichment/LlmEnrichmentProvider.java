package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.agent.MessageEnrichmentAgent;
import com.flamingo.ai.digest.agent.dto.MessageEnrichmentResult;
import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.exception.EnrichmentErrorKind;
import com.flamingo.ai.digest.exception.EnrichmentException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Enrichment provider backed by {@link MessageEnrichmentAgent}.
 *
 * <p>Each call is bounded by {@code pipeline.worker.provider-timeout}; on timeout the in-flight
 * call is interrupted. Retries are not done here: the caller records the failure and the claim
 * query picks the message up again after its backoff.
 */
@Service
@Slf4j
public class LlmEnrichmentProvider implements EnrichmentProvider {

  private static final String DEFAULT_TOPIC = "General";

  private final MessageEnrichmentAgent agent;
  private final EnrichmentErrorClassifier errorClassifier;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final ThreadPoolTaskExecutor providerCallExecutor;

  public LlmEnrichmentProvider(
      MessageEnrichmentAgent agent,
      EnrichmentErrorClassifier errorClassifier,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry,
      @Qualifier("providerCallExecutor") ThreadPoolTaskExecutor providerCallExecutor) {
    this.agent = agent;
    this.errorClassifier = errorClassifier;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.providerCallExecutor = providerCallExecutor;
  }

  @Override
  @CircuitBreaker(name = "enrichment", fallbackMethod = "enrichFallback")
  @Timed(value = "enrichment.provider", description = "Time spent in the enrichment provider")
  public EnrichmentResult enrich(EnrichmentRequest request) {
    String text = truncate(request.text());
    String digestLanguage = pipelineConfig.getEnrichment().getDigestLanguage();
    Duration timeout = pipelineConfig.getWorker().getProviderTimeout();

    Future<MessageEnrichmentResult> call =
        providerCallExecutor.submit(
            () ->
                agent.enrich(
                    orDash(request.channel()),
                    orDash(request.channelContext()),
                    orDash(request.languageHint()),
                    digestLanguage,
                    text));

    MessageEnrichmentResult raw;
    try {
      raw = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new EnrichmentException(
          EnrichmentErrorKind.TRANSIENT, "Enrichment timed out after " + timeout, e);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new EnrichmentException(EnrichmentErrorKind.TRANSIENT, "Enrichment interrupted", e);
    } catch (ExecutionException e) {
      throw errorClassifier.toException(e.getCause());
    }
    return validate(raw, request);
  }

  @SuppressWarnings("unused")
  private EnrichmentResult enrichFallback(EnrichmentRequest request, Throwable t) {
    if (t instanceof EnrichmentException enrichment) {
      throw enrichment;
    }
    log.warn("Enrichment provider unavailable, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("enrichment.provider.unavailable").increment();
    throw new EnrichmentException(
        EnrichmentErrorKind.TRANSIENT, "Enrichment provider unavailable: " + t.getMessage(), t);
  }

  private EnrichmentResult validate(MessageEnrichmentResult raw, EnrichmentRequest request) {
    if (raw == null) {
      throw new EnrichmentException(EnrichmentErrorKind.PERMANENT, "Provider returned no result");
    }
    if (raw.summary() == null || raw.summary().isBlank()) {
      throw new EnrichmentException(EnrichmentErrorKind.PERMANENT, "Provider returned no summary");
    }
    if (!isScore(raw.relevance()) || !isScore(raw.importance())) {
      throw new EnrichmentException(
          EnrichmentErrorKind.PERMANENT,
          "Provider returned invalid scores: relevance="
              + raw.relevance()
              + ", importance="
              + raw.importance());
    }
    String topic =
        raw.topic() == null || raw.topic().isBlank() ? DEFAULT_TOPIC : raw.topic().trim();
    String language =
        raw.language() == null || raw.language().isBlank()
            ? orEmpty(request.languageHint())
            : raw.language().trim();
    return new EnrichmentResult(
        topic, raw.summary().trim(), language, raw.relevance(), raw.importance());
  }

  private static boolean isScore(Double value) {
    return value != null && !value.isNaN() && value >= 0.0 && value <= 1.0;
  }

  private String truncate(String text) {
    String value = orEmpty(text);
    int max = pipelineConfig.getEnrichment().getMaxInputChars();
    if (max > 0 && value.length() > max) {
      log.debug(
          "Message too long for enrichment, truncating from {} to {} chars", value.length(), max);
      return value.substring(0, max);
    }
    return value;
  }

  private static String orDash(String value) {
    return value == null || value.isBlank() ? "-" : value;
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
