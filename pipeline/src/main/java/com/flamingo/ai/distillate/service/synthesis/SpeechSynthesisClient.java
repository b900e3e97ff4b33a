package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.exception.SpeechSynthesisException;

/** Renders text to spoken audio. */
public interface SpeechSynthesisClient {

  /**
   * Synthesizes the script.
   *
   * @return MP3 bytes
   * @throws SpeechSynthesisException if the service fails or returns no audio
   */
  byte[] synthesize(String script);
}
