package com.flamingo.ai.distillate.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline metrics.
 *
 * <p>Stage timers come from {@code @Timed}: {@code ingestion.run}, {@code distillation.run}, {@code
 * synthesis.run}, with finer timers on the external calls ({@code fetch.request}, {@code
 * distillation.item}, {@code synthesis.report}, {@code synthesis.script}, {@code
 * synthesis.speech}). Every meter carries an {@code application} tag.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:ai-distillate}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /** Backs the stage and external-call timers listed above. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
