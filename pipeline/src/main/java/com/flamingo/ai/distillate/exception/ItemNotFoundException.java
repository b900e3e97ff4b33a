package com.flamingo.ai.distillate.exception;

/** Exception thrown when an item is not found. */
public class ItemNotFoundException extends RuntimeException {

  private final String itemId;

  public ItemNotFoundException(String itemId) {
    super("Item not found: " + itemId);
    this.itemId = itemId;
  }

  public String getItemId() {
    return itemId;
  }
}
