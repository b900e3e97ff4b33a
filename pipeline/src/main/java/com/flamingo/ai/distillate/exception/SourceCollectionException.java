package com.flamingo.ai.distillate.exception;

/** Exception thrown when a whole source cannot be read, e.g. an unparseable feed document. */
public class SourceCollectionException extends RuntimeException {

  private final String sourceName;

  public SourceCollectionException(String sourceName, String message, Throwable cause) {
    super(message, cause);
    this.sourceName = sourceName;
  }

  public String getSourceName() {
    return sourceName;
  }
}
