package com.flamingo.ai.distillate.config;

import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Retry registry shared by all external call sites, with its metrics bound to Micrometer. */
@Configuration
public class ResilienceConfig {

  @Bean
  public RetryRegistry retryRegistry(MeterRegistry meterRegistry) {
    RetryRegistry registry = RetryRegistry.ofDefaults();
    TaggedRetryMetrics.ofRetryRegistry(registry).bindTo(meterRegistry);
    return registry;
  }
}
