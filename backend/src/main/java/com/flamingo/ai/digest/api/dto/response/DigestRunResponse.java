package com.flamingo.ai.digest.api.dto.response;

import com.flamingo.ai.digest.service.digest.DigestRunResult;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a digest run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestRunResponse {
  private Instant windowStart;
  private Instant windowEnd;
  private String status;
  private UUID digestId;
  private int entries;
  private String error;

  public static DigestRunResponse fromResult(DigestRunResult result) {
    return DigestRunResponse.builder()
        .windowStart(result.window().start())
        .windowEnd(result.window().end())
        .status(result.status().name())
        .digestId(result.digestId())
        .entries(result.entries())
        .error(result.error())
        .build();
  }
}
