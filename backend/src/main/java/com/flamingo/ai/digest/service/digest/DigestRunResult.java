package com.flamingo.ai.digest.service.digest;

import com.flamingo.ai.digest.domain.model.TimeWindow;
import java.util.UUID;

/** Outcome of one digest assembly attempt. */
public record DigestRunResult(
    TimeWindow window, Status status, UUID digestId, int entries, String error) {

  public enum Status {
    /** Published and recorded. */
    POSTED,
    /** Window already posted, or failed within the retry grace interval. */
    ALREADY_EXISTS,
    /** Another instance holds the window lock. */
    LOCKED,
    /** No eligible items in the window. */
    NOTHING_TO_PUBLISH,
    /** Transport failed; the error is recorded on the digest row. */
    FAILED
  }

  static DigestRunResult skipped(TimeWindow window, Status status) {
    return new DigestRunResult(window, status, null, 0, null);
  }
}
