package com.flamingo.ai.digest.exception;

/** Exception thrown when the transport rejects or fails to deliver a digest. */
public class DigestPublishException extends RuntimeException {

  private final boolean transientFailure;

  public DigestPublishException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public DigestPublishException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
