package com.flamingo.ai.digest.service.enrichment;

/** Outcome of the content filter gate; {@code reason} is a drop-log reason code when filtered. */
public record FilterDecision(boolean filtered, String reason) {

  private static final FilterDecision PASS = new FilterDecision(false, "");

  public static FilterDecision pass() {
    return PASS;
  }

  public static FilterDecision reject(String reason) {
    return new FilterDecision(true, reason);
  }
}
