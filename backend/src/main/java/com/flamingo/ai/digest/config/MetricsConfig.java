package com.flamingo.ai.digest.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Pipeline metrics: {@code @Timed} support and tags shared by every meter. */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags worker, dedup and digest meters with the application and digest language. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> pipelineCommonTags(
      @Value("${spring.application.name:digest-pipeline}") String applicationName,
      PipelineConfig pipelineConfig) {
    return registry ->
        registry
            .config()
            .commonTags(
                "application",
                applicationName,
                "digest_language",
                pipelineConfig.getEnrichment().getDigestLanguage());
  }
}
