package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.exception.TranscriptUnavailableException;
import java.util.List;

/** Retrieves the spoken-text transcript of a video. */
public interface TranscriptClient {

  /**
   * Returns the transcript segments of the video in playback order.
   *
   * @param watchPage the video's watch page, already downloaded by the caller
   * @throws TranscriptUnavailableException if the video has no retrievable transcript
   */
  List<String> fetchSegments(String videoId, String watchPage);
}
