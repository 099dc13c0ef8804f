package com.flamingo.ai.digest.api.dto.response;

import com.flamingo.ai.digest.service.clustering.ClusteringResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a cluster rebuild. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusteringResponse {
  private Instant windowStart;
  private Instant windowEnd;
  private int items;
  private int clusters;

  public static ClusteringResponse fromResult(ClusteringResult result) {
    return ClusteringResponse.builder()
        .windowStart(result.window().start())
        .windowEnd(result.window().end())
        .items(result.items())
        .clusters(result.clusters())
        .build();
  }
}
