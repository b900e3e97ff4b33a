package com.flamingo.ai.distillate.runner;

import com.flamingo.ai.distillate.domain.migration.SchemaMigrator;
import com.flamingo.ai.distillate.exception.SchemaMigrationException;
import com.flamingo.ai.distillate.service.distillation.DistillationResult;
import com.flamingo.ai.distillate.service.distillation.DistillationWorker;
import com.flamingo.ai.distillate.service.ingestion.IngestionCollector;
import com.flamingo.ai.distillate.service.status.PipelineStatusService;
import com.flamingo.ai.distillate.service.synthesis.SynthesisResult;
import com.flamingo.ai.distillate.service.synthesis.SynthesisWorker;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Runs the stages given as {@code --stage=<name>} options, in order, after migrating the schema.
 *
 * <p>Workers are resolved only when their stage runs, so an ingestion-only invocation never builds
 * the language-model clients. Exit codes: 0 success (including a held distillation guard), 1 a
 * stage failed, 2 the store is unavailable or cannot be migrated, 64 usage error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineStageRunner implements ApplicationRunner, ExitCodeGenerator {

  static final String STAGE_OPTION = "stage";

  static final int EXIT_OK = 0;
  static final int EXIT_STAGE_FAILED = 1;
  static final int EXIT_STORE_UNAVAILABLE = 2;
  static final int EXIT_USAGE = 64;

  private final SchemaMigrator schemaMigrator;
  private final ObjectProvider<IngestionCollector> ingestionCollector;
  private final ObjectProvider<DistillationWorker> distillationWorker;
  private final ObjectProvider<SynthesisWorker> synthesisWorker;
  private final ObjectProvider<PipelineStatusService> pipelineStatusService;

  private int exitCode = EXIT_OK;

  @Override
  public void run(ApplicationArguments args) {
    List<PipelineStage> stages;
    try {
      stages = parseStages(args);
    } catch (IllegalArgumentException e) {
      log.error("{}. Usage: --stage=<{}> (repeatable)", e.getMessage(), PipelineStage.names());
      exitCode = EXIT_USAGE;
      return;
    }

    try {
      schemaMigrator.migrate();
    } catch (SchemaMigrationException e) {
      log.error("Schema migration failed at version {}: {}", e.getVersion(), e.getMessage());
      exitCode = EXIT_STORE_UNAVAILABLE;
      return;
    }

    for (PipelineStage stage : stages) {
      log.info("Running stage {}", stage);
      try {
        if (!runStage(stage)) {
          exitCode = Math.max(exitCode, EXIT_STAGE_FAILED);
        }
      } catch (DataAccessException e) {
        log.error("Item store unavailable during {}: {}", stage, e.getMessage());
        exitCode = EXIT_STORE_UNAVAILABLE;
        return;
      } catch (RuntimeException e) {
        log.error("Stage {} failed: {}", stage, e.getMessage(), e);
        exitCode = Math.max(exitCode, EXIT_STAGE_FAILED);
      }
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** Returns false when the stage completed but reported a failure. */
  private boolean runStage(PipelineStage stage) {
    switch (stage) {
      case INGEST:
        ingestionCollector.getObject().collect();
        return true;
      case DISTILL:
        DistillationResult distillation = distillationWorker.getObject().run();
        if (distillation.storeFailed()) {
          exitCode = EXIT_STORE_UNAVAILABLE;
        }
        return !distillation.isFailure();
      case SYNTHESIZE:
        SynthesisResult synthesis = synthesisWorker.getObject().run();
        return !synthesis.isFailure();
      case STATUS:
        pipelineStatusService.getObject().report();
        return true;
      default:
        throw new IllegalStateException("Unhandled stage " + stage);
    }
  }

  static List<PipelineStage> parseStages(ApplicationArguments args) {
    List<String> values = args.getOptionValues(STAGE_OPTION);
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("No stage given");
    }
    List<PipelineStage> stages = new ArrayList<>();
    for (String value : values) {
      for (String part : value.split(",")) {
        if (!part.isBlank()) {
          stages.add(PipelineStage.fromOption(part));
        }
      }
    }
    if (stages.isEmpty()) {
      throw new IllegalArgumentException("No stage given");
    }
    return stages;
  }
}
