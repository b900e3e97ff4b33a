package com.flamingo.ai.distillate.exception;

/** Exception thrown when a URL cannot be retrieved after all retry attempts. */
public class FetchException extends RuntimeException {

  private final String url;

  public FetchException(String url, String message) {
    super(message);
    this.url = url;
  }

  public FetchException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
