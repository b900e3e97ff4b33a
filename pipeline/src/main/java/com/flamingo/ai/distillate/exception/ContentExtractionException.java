package com.flamingo.ai.distillate.exception;

/** Exception thrown when readable text cannot be extracted from a fetched page. */
public class ContentExtractionException extends RuntimeException {

  public ContentExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
