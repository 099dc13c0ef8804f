package com.flamingo.ai.digest.api.dto.response;

import com.flamingo.ai.digest.storage.model.ItemErrorView;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a failed item. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemErrorResponse {

  private UUID itemId;
  private UUID rawMessageId;
  private String channel;
  private long sourceMessageId;
  private int retryCount;
  private Instant nextRetryAt;
  private String errorMessage;
  private Instant updatedAt;

  public static ItemErrorResponse fromView(ItemErrorView view) {
    return ItemErrorResponse.builder()
        .itemId(view.itemId())
        .rawMessageId(view.rawMessageId())
        .channel(view.channel())
        .sourceMessageId(view.sourceMessageId())
        .retryCount(view.retryCount())
        .nextRetryAt(view.nextRetryAt())
        .errorMessage(view.errorMessage())
        .updatedAt(view.updatedAt())
        .build();
  }
}
