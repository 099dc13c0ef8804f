package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates message embeddings. Vectors are padded or truncated to the configured width; an empty
 * array means the embedding is unavailable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small allows 8192 tokens; dense CJK text can approach one char per token
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private static final float[] NO_EMBEDDING = new float[0];

  private final EmbeddingModel embeddingModel;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public float[] embed(String text) {
    if (text == null || text.isBlank()) {
      throw new EmbeddingException("Cannot embed empty text");
    }
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.debug(
          "Text too long for embedding, truncating from {} to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(input);
      if (response == null || response.content() == null) {
        throw new EmbeddingException("Embedding provider returned no vector");
      }
      float[] vector = response.content().vector();
      if (vector == null || vector.length == 0) {
        throw new EmbeddingException("Embedding provider returned an empty vector");
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return fitToDimensions(vector);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  float[] fitToDimensions(float[] vector) {
    int dimensions = pipelineConfig.getEnrichment().getEmbeddingDimensions();
    if (vector.length == dimensions) {
      return vector;
    }
    log.debug("Resizing embedding from {} to {} dimensions", vector.length, dimensions);
    return Arrays.copyOf(vector, dimensions);
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, continuing without vector: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return NO_EMBEDDING;
  }
}
