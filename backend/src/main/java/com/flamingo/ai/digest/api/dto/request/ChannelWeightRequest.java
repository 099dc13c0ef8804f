package com.flamingo.ai.digest.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO setting a channel's importance weight. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelWeightRequest {

  @NotNull(message = "Weight is required")
  @DecimalMin(value = "0.1", message = "Weight must be at least 0.1")
  @DecimalMax(value = "2.0", message = "Weight must not exceed 2.0")
  private Double weight;
}
