package com.flamingo.ai.distillate.exception;

/** Exception thrown when a video has no retrievable transcript. */
public class TranscriptUnavailableException extends RuntimeException {

  private final String videoId;

  public TranscriptUnavailableException(String videoId, String message) {
    super(message);
    this.videoId = videoId;
  }

  public TranscriptUnavailableException(String videoId, String message, Throwable cause) {
    super(message, cause);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
