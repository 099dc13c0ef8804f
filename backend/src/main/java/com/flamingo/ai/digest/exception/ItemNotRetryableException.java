package com.flamingo.ai.digest.exception;

import com.flamingo.ai.digest.domain.enums.ItemStatus;
import java.util.UUID;

/** Exception thrown when a retry is requested for an item that has not failed. */
public class ItemNotRetryableException extends RuntimeException {

  private final UUID itemId;
  private final ItemStatus status;

  public ItemNotRetryableException(UUID itemId, ItemStatus status) {
    super("Item " + itemId + " is " + status + ", only failed items can be retried");
    this.itemId = itemId;
    this.status = status;
  }

  public UUID getItemId() {
    return itemId;
  }

  public ItemStatus getStatus() {
    return status;
  }
}
