package com.flamingo.ai.digest.exception;

/** Exception thrown when the durable store fails. */
public class StorageException extends RuntimeException {

  private final boolean transientFailure;

  public StorageException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /** Contention or serialization aborts that succeed when the operation is simply repeated. */
  public boolean isTransient() {
    return transientFailure;
  }
}
