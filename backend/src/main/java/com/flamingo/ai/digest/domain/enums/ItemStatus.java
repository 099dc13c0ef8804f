package com.flamingo.ai.digest.domain.enums;

/** Lifecycle status of an enriched item. */
public enum ItemStatus {
  /** Enriched and waiting for a digest. */
  READY,

  /** Enrichment failed; retried while the retry budget lasts. */
  ERROR,

  /** Queued for another enrichment attempt by an operator. */
  RETRY,

  /** Included in a posted digest. */
  DIGESTED,

  /** Near or exact copy of an earlier item; skipped by the digest. */
  DUPLICATE,

  /** Enriched but below the relevance floor; never digested. */
  REJECTED
}
