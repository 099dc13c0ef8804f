package com.flamingo.ai.digest.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.digest.agent.MessageEnrichmentAgent;
import com.flamingo.ai.digest.agent.dto.MessageEnrichmentResult;
import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.exception.EnrichmentErrorKind;
import com.flamingo.ai.digest.exception.EnrichmentException;
import dev.langchain4j.exception.HttpException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmEnrichmentProvider Tests")
class LlmEnrichmentProviderTest {

  @Mock private MessageEnrichmentAgent agent;

  private PipelineConfig config;
  private ThreadPoolTaskExecutor executor;
  private LlmEnrichmentProvider provider;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    config.getWorker().setProviderTimeout(Duration.ofMillis(300));
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.initialize();
    provider =
        new LlmEnrichmentProvider(
            agent, new EnrichmentErrorClassifier(), config, new SimpleMeterRegistry(), executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  @DisplayName("Should return validated agent output")
  void shouldReturnAgentOutput() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenReturn(
            new MessageEnrichmentResult(
                " Central banks ", "The central bank raised rates.", "de", 0.9, 0.7));

    EnrichmentResult result = provider.enrich(request("Die Zentralbank erhöht die Zinsen"));

    assertThat(result.topic()).isEqualTo("Central banks");
    assertThat(result.summary()).isEqualTo("The central bank raised rates.");
    assertThat(result.language()).isEqualTo("de");
    assertThat(result.relevance()).isEqualTo(0.9);
    assertThat(result.importance()).isEqualTo(0.7);
    verify(agent)
        .enrich(eq("newsroom"), eq("Economy news"), eq("en"), eq("en"), anyString());
  }

  @Test
  @DisplayName("Should truncate long input before calling the agent")
  void shouldTruncateInput() {
    config.getEnrichment().setMaxInputChars(10);
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenReturn(new MessageEnrichmentResult("t", "s", "en", 0.5, 0.5));

    provider.enrich(request("x".repeat(100)));

    verify(agent)
        .enrich(anyString(), anyString(), anyString(), anyString(), argThat(t -> t.length() == 10));
  }

  @Test
  @DisplayName("Should map rate limiting to RATE_LIMITED")
  void shouldMapRateLimit() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenThrow(new HttpException(429, "Too many requests"));

    assertThatThrownBy(() -> provider.enrich(request("some news text")))
        .isInstanceOf(EnrichmentException.class)
        .satisfies(
            e ->
                assertThat(((EnrichmentException) e).getKind())
                    .isEqualTo(EnrichmentErrorKind.RATE_LIMITED));
  }

  @Test
  @DisplayName("Should map a bad request to PERMANENT")
  void shouldMapBadRequest() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenThrow(new HttpException(400, "Invalid request"));

    assertThatThrownBy(() -> provider.enrich(request("some news text")))
        .isInstanceOf(EnrichmentException.class)
        .satisfies(e -> assertThat(((EnrichmentException) e).isRetryable()).isFalse());
  }

  @Test
  @DisplayName("Should give up at the provider timeout with a transient error")
  void shouldTimeOut() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return new MessageEnrichmentResult("t", "s", "en", 0.5, 0.5);
            });

    assertThatThrownBy(() -> provider.enrich(request("some news text")))
        .isInstanceOf(EnrichmentException.class)
        .satisfies(
            e ->
                assertThat(((EnrichmentException) e).getKind())
                    .isEqualTo(EnrichmentErrorKind.TRANSIENT))
        .hasMessageContaining("timed out");
  }

  @Test
  @DisplayName("Should reject out-of-range scores as permanent")
  void shouldRejectInvalidScores() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenReturn(new MessageEnrichmentResult("t", "summary", "en", 1.5, 0.5));

    assertThatThrownBy(() -> provider.enrich(request("some news text")))
        .isInstanceOf(EnrichmentException.class)
        .satisfies(
            e ->
                assertThat(((EnrichmentException) e).getKind())
                    .isEqualTo(EnrichmentErrorKind.PERMANENT));
  }

  @Test
  @DisplayName("Should reject a missing summary and default a missing topic")
  void shouldValidateTextFields() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyString()))
        .thenReturn(new MessageEnrichmentResult("t", " ", "en", 0.5, 0.5))
        .thenReturn(new MessageEnrichmentResult(null, "A summary.", null, 0.5, 0.5));

    assertThatThrownBy(() -> provider.enrich(request("some news text")))
        .isInstanceOf(EnrichmentException.class);

    EnrichmentResult result = provider.enrich(request("some news text"));
    assertThat(result.topic()).isEqualTo("General");
    assertThat(result.language()).isEqualTo("en");
  }

  private static EnrichmentRequest request(String text) {
    return new EnrichmentRequest("newsroom", "Economy news", "en", text);
  }
}
