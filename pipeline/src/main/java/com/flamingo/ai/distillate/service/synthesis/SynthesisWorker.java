package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.agent.dto.ExecutiveReportDraft;
import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.service.store.ItemStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Synthesis stage: folds the selected batch into one report with a spoken rendition.
 *
 * <p>The report row and the synthesized flags of the batch are committed together. Nothing is
 * written to the store when any step fails, and audio written for a failed run is deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SynthesisWorker {

  private final SynthesisBatchSelector batchSelector;
  private final CorpusBuilder corpusBuilder;
  private final ExecutiveReportService executiveReportService;
  private final AudioRenderer audioRenderer;
  private final ItemStore itemStore;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Timed(value = "synthesis.run", description = "Time to synthesize one report")
  public SynthesisResult run() {
    SynthesisBatch batch = batchSelector.select();
    if (batch.isEmpty()) {
      log.info("Nothing to synthesize");
      return SynthesisResult.noOp();
    }

    LocalDateTime generatedAt = LocalDateTime.now(clock);
    Path audioFile = null;
    try {
      ExecutiveReportDraft draft =
          executiveReportService.draftReport(corpusBuilder.summaryCorpus(batch.items()));
      String script = executiveReportService.writeScript(corpusBuilder.rawCorpus(batch.items()));
      audioFile = audioRenderer.render(script, generatedAt);

      Report report =
          Report.builder()
              .generatedAt(generatedAt)
              .whatsNew(draft.whatsNew())
              .featureBriefSummary(draft.featureBriefSummary())
              .keyTakeaways(draft.keyTakeaways())
              .audioPath(audioFile.toString())
              .build();
      Report saved = itemStore.commitReport(report, batch.ids());

      meterRegistry.counter("synthesis.reports.created").increment();
      log.info("Report {} created from {} item(s)", saved.getId(), batch.size());
      return SynthesisResult.created(saved.getId(), batch.size());
    } catch (RuntimeException e) {
      if (audioFile != null) {
        audioRenderer.discard(audioFile);
      }
      meterRegistry.counter("synthesis.reports.failure").increment();
      log.error("Synthesis of {} item(s) rolled back: {}", batch.size(), e.getMessage(), e);
      return SynthesisResult.failed(batch.size(), e.getMessage());
    }
  }
}
