package com.flamingo.ai.distillate.exception;

/** Exception thrown when the item store schema cannot be brought up to date. */
public class SchemaMigrationException extends RuntimeException {

  private final int version;

  public SchemaMigrationException(int version, String message, Throwable cause) {
    super(message, cause);
    this.version = version;
  }

  public int getVersion() {
    return version;
  }
}
