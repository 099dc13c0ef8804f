package com.flamingo.ai.digest.service.digest;

import com.flamingo.ai.digest.exception.DigestPublishException;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import java.util.List;

/** Transport adapter that delivers an assembled digest to a chat. */
public interface DigestPublisher {

  /**
   * @throws DigestPublishException flagged transient or permanent
   */
  PublishReceipt publish(String chatId, List<DigestEntryDraft> entries);
}
