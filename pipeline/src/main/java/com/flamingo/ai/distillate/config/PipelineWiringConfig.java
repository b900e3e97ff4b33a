package com.flamingo.ai.distillate.config;

import com.flamingo.ai.distillate.service.guard.RunGuard;
import com.flamingo.ai.distillate.service.ingestion.SourceRegistry;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wiring for the stage collaborators that are plain values rather than Spring components. */
@Configuration
public class PipelineWiringConfig {

  /** All stage timestamps are taken in UTC. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SourceRegistry sourceRegistry(PipelineConfig pipelineConfig) {
    return SourceRegistry.fromConfig(pipelineConfig.getSources());
  }

  @Bean
  public RunGuard distillationRunGuard(PipelineConfig pipelineConfig) {
    return new RunGuard(Path.of(pipelineConfig.getDistillation().getGuardFile()));
  }
}
