package com.flamingo.ai.digest.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineConfig Tests")
class PipelineConfigTest {

  @Test
  @DisplayName("Should accept the defaults")
  void shouldAcceptDefaults() {
    assertThatCode(() -> new PipelineConfig().validate()).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Should reject thresholds outside [0, 1]")
  void shouldRejectOutOfRangeThresholds() {
    PipelineConfig config = new PipelineConfig();
    config.getClustering().setSimilarity(1.2);

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("pipeline.clustering.similarity");
  }

  @Test
  @DisplayName("Should reject a global threshold below the intra-channel one")
  void shouldRejectGlobalBelowIntra() {
    PipelineConfig config = new PipelineConfig();
    config.getDedup().setGlobalSimilarity(0.80);
    config.getDedup().setIntraSimilarity(0.85);

    assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject a global window shorter than the intra-channel one")
  void shouldRejectShortGlobalWindow() {
    PipelineConfig config = new PipelineConfig();
    config.getDedup().setGlobalWindow(Duration.ofHours(1));

    assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should reject a non-positive retry budget")
  void shouldRejectZeroRetries() {
    PipelineConfig config = new PipelineConfig();
    config.getRetry().setMaxRetries(0);

    assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class);
  }
}
