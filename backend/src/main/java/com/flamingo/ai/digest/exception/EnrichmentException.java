package com.flamingo.ai.digest.exception;

/** Exception thrown when a message cannot be enriched. */
public class EnrichmentException extends RuntimeException {

  private final EnrichmentErrorKind kind;

  public EnrichmentException(EnrichmentErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public EnrichmentException(EnrichmentErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public EnrichmentErrorKind getKind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }
}
