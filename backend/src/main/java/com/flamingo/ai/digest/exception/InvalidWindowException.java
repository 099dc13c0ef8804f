package com.flamingo.ai.digest.exception;

import java.time.Instant;

/** Exception thrown when an operator request names an empty or inverted time window. */
public class InvalidWindowException extends RuntimeException {

  private final Instant start;
  private final Instant end;

  public InvalidWindowException(Instant start, Instant end, Throwable cause) {
    super("Invalid window: [" + start + ", " + end + ")", cause);
    this.start = start;
    this.end = end;
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }
}
