package com.flamingo.ai.digest.exception;

/** Failure classes reported by the enrichment provider. */
public enum EnrichmentErrorKind {
  /** Timeouts, connection failures, provider 5xx. Retried with backoff. */
  TRANSIENT,

  /** Invalid input or unusable output. Not retried. */
  PERMANENT,

  /** Provider throttling. Retried with backoff. */
  RATE_LIMITED;

  public boolean isRetryable() {
    return this != PERMANENT;
  }
}
