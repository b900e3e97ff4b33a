package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.exception.SpeechSynthesisException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the synthesized briefing to {@code <audio-dir>/podcast_<yyyyMMdd_HHmmss>.mp3}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AudioRenderer {

  private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final SpeechSynthesisClient speechSynthesisClient;
  private final PipelineConfig pipelineConfig;

  /**
   * Renders the script and writes the audio file.
   *
   * @return path of the written file
   * @throws SpeechSynthesisException if synthesis or the write fails
   */
  public Path render(String script, LocalDateTime generatedAt) {
    byte[] audio = speechSynthesisClient.synthesize(script);
    Path target = fileFor(generatedAt);
    try {
      Files.createDirectories(target.toAbsolutePath().getParent());
      Files.write(target, audio);
    } catch (IOException e) {
      throw new SpeechSynthesisException("Cannot write audio file " + target, e);
    }
    log.info("Wrote briefing audio {} ({} bytes)", target, audio.length);
    return target;
  }

  /** Removes an audio file whose report was not committed. */
  public void discard(Path audioFile) {
    try {
      if (Files.deleteIfExists(audioFile)) {
        log.info("Discarded uncommitted audio {}", audioFile);
      }
    } catch (IOException e) {
      log.error("Failed to discard audio {}: {}", audioFile, e.getMessage());
    }
  }

  Path fileFor(LocalDateTime generatedAt) {
    return Path.of(pipelineConfig.getSynthesis().getAudioDir())
        .resolve("podcast_" + FILE_STAMP.format(generatedAt) + ".mp3");
  }
}
