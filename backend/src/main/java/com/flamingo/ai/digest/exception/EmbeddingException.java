package com.flamingo.ai.digest.exception;

/** Exception thrown when the embedding provider fails or returns no vector. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
