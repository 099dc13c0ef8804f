package com.flamingo.ai.digest.domain.enums;

/** What the worker records for a message rejected by the content filters. */
public enum FilteredMessageMode {
  /** Write a ready item with zero relevance so the message is visibly accounted for. */
  ZERO_RELEVANCE,

  /** Write a drop-log row and no item. */
  DROP_LOG
}
