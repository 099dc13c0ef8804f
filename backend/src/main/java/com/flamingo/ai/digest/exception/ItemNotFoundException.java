package com.flamingo.ai.digest.exception;

import java.util.UUID;

/** Exception thrown when an item is not found. */
public class ItemNotFoundException extends RuntimeException {

  private final UUID itemId;

  public ItemNotFoundException(UUID itemId) {
    super("Item not found: " + itemId);
    this.itemId = itemId;
  }

  public UUID getItemId() {
    return itemId;
  }
}
