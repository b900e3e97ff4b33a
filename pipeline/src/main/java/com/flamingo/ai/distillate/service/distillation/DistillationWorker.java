package com.flamingo.ai.distillate.service.distillation;

import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.service.guard.RunGuard;
import com.flamingo.ai.distillate.service.store.ItemStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Distillation stage: gives every unprocessed item a category and condensed summary.
 *
 * <p>Runs under the distillation {@link RunGuard}; a second invocation overlapping a live one
 * returns without touching the store. Each item is committed on its own, so a crash loses at most
 * the item in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistillationWorker {

  private final RunGuard distillationRunGuard;
  private final ItemStore itemStore;
  private final DistillationService distillationService;
  private final MeterRegistry meterRegistry;

  @Timed(value = "distillation.run", description = "Time to distill the pending backlog")
  public DistillationResult run() {
    Optional<RunGuard.Lease> lease = distillationRunGuard.tryAcquire();
    if (lease.isEmpty()) {
      log.warn("Another distillation is running, exiting");
      return DistillationResult.guardHeld();
    }
    try (RunGuard.Lease held = lease.get()) {
      return distillPending();
    }
  }

  private DistillationResult distillPending() {
    List<Item> pending;
    try {
      pending = itemStore.findUnprocessed();
    } catch (DataAccessException e) {
      log.error("Cannot load pending items: {}", e.getMessage());
      return DistillationResult.storeUnavailable();
    }
    log.info("Distillation started for {} pending item(s)", pending.size());

    int distilled = 0;
    int emptied = 0;
    int failed = 0;
    for (Item item : pending) {
      if (item.hasBlankText()) {
        itemStore.markProcessedWithoutContent(item.getId());
        emptied++;
        log.info("Item {} has no text, marked processed without category", item.getId());
        continue;
      }
      try {
        ItemDistillation distillation = distillationService.distill(item.getTitle(), item.getRawText());
        itemStore.markDistilled(item.getId(), distillation.category(), distillation.summary());
        distilled++;
        meterRegistry.counter("distillation.items.success").increment();
        log.info("Distilled item {} as {}", item.getId(), distillation.category());
      } catch (RuntimeException e) {
        failed++;
        meterRegistry.counter("distillation.items.failure").increment();
        log.error("Distillation of item {} failed, left for next run: {}", item.getId(), e.getMessage());
      }
    }

    log.info("Distillation finished: {} distilled, {} empty, {} failed", distilled, emptied, failed);
    return new DistillationResult(true, false, distilled, emptied, failed);
  }
}
