package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.storage.model.ClaimedMessage;

/** Predicate deciding whether a claimed message is excluded before enrichment. */
public interface MessageFilter {

  FilterDecision evaluate(ClaimedMessage message);
}
