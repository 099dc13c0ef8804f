package com.flamingo.ai.digest.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String ITEM_NOT_FOUND = "ITEM_001";
  public static final String ITEM_NOT_RETRYABLE = "ITEM_002";
  public static final String INVALID_WINDOW = "WINDOW_001";
  public static final String CHANNEL_NOT_FOUND = "CHANNEL_001";
  public static final String STORAGE_UNAVAILABLE = "STORAGE_001";
  public static final String STORAGE_ERROR = "STORAGE_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
