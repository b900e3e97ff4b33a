package com.flamingo.ai.distillate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the pipeline. Each invocation runs the stages named with {@code --stage} and exits
 * with the code reported by {@link com.flamingo.ai.distillate.runner.PipelineStageRunner}.
 */
@SpringBootApplication
public class DistillateApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(DistillateApplication.class, args)));
  }
}
