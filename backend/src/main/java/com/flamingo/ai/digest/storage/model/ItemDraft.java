package com.flamingo.ai.digest.storage.model;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import java.time.Instant;
import java.util.UUID;

/** Terminal enrichment outcome to be stored for one raw message. */
public record ItemDraft(
    UUID rawMessageId,
    ItemStatus status,
    double relevanceScore,
    double importanceScore,
    String topic,
    String summary,
    String language,
    Instant firstSeenAt,
    UUID duplicateOfItemId) {

  public ItemDraft withDuplicateOf(UUID canonicalItemId) {
    return new ItemDraft(
        rawMessageId,
        ItemStatus.DUPLICATE,
        relevanceScore,
        importanceScore,
        topic,
        summary,
        language,
        firstSeenAt,
        canonicalItemId);
  }
}
