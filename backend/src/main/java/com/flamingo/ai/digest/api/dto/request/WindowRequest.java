package com.flamingo.ai.digest.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO naming a half-open window {@code [start, end)}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowRequest {

  @NotNull(message = "Window start is required")
  private Instant start;

  @NotNull(message = "Window end is required")
  private Instant end;

  /** Target chat for digests. If null, uses pipeline.digest.chat-id. */
  @Size(max = 128, message = "Chat id must not exceed 128 characters")
  private String chatId;
}
