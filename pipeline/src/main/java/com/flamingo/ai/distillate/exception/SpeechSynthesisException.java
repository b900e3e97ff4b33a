package com.flamingo.ai.distillate.exception;

/** Exception thrown when the briefing script cannot be rendered to audio. */
public class SpeechSynthesisException extends RuntimeException {

  public SpeechSynthesisException(String message) {
    super(message);
  }

  public SpeechSynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
