package com.flamingo.ai.digest.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private PipelineConfig config;
  private MeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    config.getEnrichment().setEmbeddingDimensions(4);
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new EmbeddingService(embeddingModel, config, meterRegistry);
  }

  @Test
  @DisplayName("Should return the provider vector and count the request")
  void shouldEmbed() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f, 0.3f, 0.4f));

    float[] vector = embeddingService.embed("Central bank raises rates");

    assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f, 0.4f);
    Counter success = meterRegistry.find("embedding.requests.success").counter();
    assertThat(success).isNotNull();
    assertThat(success.count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should pad short vectors and truncate long ones to the configured width")
  void shouldFitDimensions() {
    assertThat(embeddingService.fitToDimensions(new float[] {1f, 2f}))
        .containsExactly(1f, 2f, 0f, 0f);
    assertThat(embeddingService.fitToDimensions(new float[] {1f, 2f, 3f, 4f, 5f}))
        .containsExactly(1f, 2f, 3f, 4f);
  }

  @Test
  @DisplayName("Should truncate very long text")
  void shouldTruncateLongText() {
    when(embeddingModel.embed(anyString())).thenReturn(response(1f, 0f, 0f, 0f));

    embeddingService.embed("b".repeat(6000));

    verify(embeddingModel).embed(argThat((String text) -> text.length() == 5000));
  }

  @Test
  @DisplayName("Should fail on an empty provider vector")
  void shouldFailOnEmptyVector() {
    lenient().when(embeddingModel.embed(anyString())).thenReturn(response());

    assertThatThrownBy(() -> embeddingService.embed("some text"))
        .isInstanceOf(EmbeddingException.class);
  }

  private static Response<Embedding> response(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
