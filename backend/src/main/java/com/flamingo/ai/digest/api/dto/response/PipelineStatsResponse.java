package com.flamingo.ai.digest.api.dto.response;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import com.flamingo.ai.digest.storage.model.PipelineStats;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for pipeline backlog statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStatsResponse {
  private long unprocessedMessages;
  private long claimedMessages;
  private Map<String, Long> itemsByStatus;
  private long postedDigests;
  private long failedDigests;
  private Instant timestamp;

  public static PipelineStatsResponse fromStats(PipelineStats stats, Instant timestamp) {
    Map<String, Long> byStatus = new LinkedHashMap<>();
    for (Map.Entry<ItemStatus, Long> entry : stats.itemsByStatus().entrySet()) {
      byStatus.put(entry.getKey().name(), entry.getValue());
    }
    return PipelineStatsResponse.builder()
        .unprocessedMessages(stats.unprocessedMessages())
        .claimedMessages(stats.claimedMessages())
        .itemsByStatus(byStatus)
        .postedDigests(stats.postedDigests())
        .failedDigests(stats.failedDigests())
        .timestamp(timestamp)
        .build();
  }
}
