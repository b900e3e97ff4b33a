package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.service.store.ItemStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the items of the next report: the processed backlog not yet reported, plus the newest
 * live-briefing edition published within the freshness window even when it was reported before.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SynthesisBatchSelector {

  private final ItemStore itemStore;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  public SynthesisBatch select() {
    PipelineConfig.Synthesis synthesis = pipelineConfig.getSynthesis();
    List<Item> backlog = itemStore.findUnsynthesized();
    LocalDateTime since = LocalDateTime.now(clock).minus(synthesis.getLiveBriefingWindow());
    Optional<Item> liveBriefing =
        itemStore.findLatestLiveBriefing(synthesis.getLiveBriefingSource(), since);

    SynthesisBatch batch = SynthesisBatch.of(backlog, liveBriefing);
    log.info(
        "Selected {} item(s) for synthesis: {} backlog, live briefing {}",
        batch.size(),
        backlog.size(),
        liveBriefing.map(Item::getId).orElse("none"));
    return batch;
  }
}
