package com.flamingo.ai.digest.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.digest.api.rest.HealthController;
import com.flamingo.ai.digest.api.rest.PipelineController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the operator API paths.
 *
 * <ul>
 *   <li>GET /api/pipeline/errors - Recent failed items
 *   <li>POST /api/pipeline/items/{itemId}/retry - Requeue one item
 *   <li>POST /api/pipeline/items/retry-failed - Requeue all failed items
 *   <li>DELETE /api/pipeline/digests/errors - Clear failed digests
 *   <li>GET /api/pipeline/stats - Backlog statistics
 *   <li>POST /api/pipeline/clusters - Rebuild the clusters of a window
 *   <li>POST /api/pipeline/digests - Publish the digest of a window
 *   <li>GET /api/health - Health check
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("PipelineController API contract")
  class PipelineControllerContract {

    @Test
    @DisplayName("should be mapped to /api/pipeline")
    void shouldBeMappedToApiPipeline() {
      RequestMapping mapping = PipelineController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/pipeline");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /api/health")
    void shouldBeMappedToApiHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/health");
    }
  }
}
