package com.flamingo.ai.distillate.exception;

/** Exception thrown when the language-model service fails or returns an unusable response. */
public class LlmServiceException extends RuntimeException {

  private final boolean malformedResponse;

  public LlmServiceException(String message) {
    super(message);
    this.malformedResponse = false;
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.malformedResponse = false;
  }

  public LlmServiceException(String message, boolean malformedResponse) {
    super(message);
    this.malformedResponse = malformedResponse;
  }

  /** True when the service answered but the structured result was empty or incomplete. */
  public boolean isMalformedResponse() {
    return malformedResponse;
  }
}
