package com.flamingo.ai.digest.service.enrichment;

/** How one claimed message left the processor. */
public enum ProcessingOutcome {
  /** New digest-eligible item. */
  READY,
  /** Item kept but linked to an earlier canonical item. */
  DUPLICATE,
  /** Enriched, but below the relevance floor. */
  REJECTED,
  /** Stopped by the content filter gate. */
  FILTERED,
  /** Provider failed transiently; claim released for a later attempt. */
  RETRY_SCHEDULED,
  /** Permanent provider failure or retry budget exhausted; message completed with an error. */
  FAILED
}
