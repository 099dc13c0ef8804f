package com.flamingo.ai.digest.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Number of rows affected by an operator action. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountResponse {
  private int count;
}
