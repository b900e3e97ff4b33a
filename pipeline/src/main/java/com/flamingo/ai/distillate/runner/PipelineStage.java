package com.flamingo.ai.distillate.runner;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Stages selectable with {@code --stage}. */
public enum PipelineStage {
  INGEST,
  DISTILL,
  SYNTHESIZE,
  STATUS;

  /**
   * Resolves a command-line value such as {@code distill}.
   *
   * @throws IllegalArgumentException for an unknown stage name
   */
  public static PipelineStage fromOption(String value) {
    String normalized = value == null ? "" : value.strip().toUpperCase(Locale.ROOT);
    for (PipelineStage stage : values()) {
      if (stage.name().equals(normalized)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown stage '" + value + "', expected one of " + names());
  }

  public static String names() {
    return Arrays.stream(values())
        .map(stage -> stage.name().toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(", "));
  }
}
