package com.flamingo.ai.distillate.service.distillation;

/**
 * Outcome of one distillation pass.
 *
 * @param guardAcquired false when another live process was already distilling
 * @param storeFailed true when pending items could not be loaded
 * @param distilled items given a category and summary
 * @param emptied items without text, marked processed with no category
 * @param failed items left unprocessed after exhausted retries
 */
public record DistillationResult(
    boolean guardAcquired, boolean storeFailed, int distilled, int emptied, int failed) {

  static DistillationResult guardHeld() {
    return new DistillationResult(false, false, 0, 0, 0);
  }

  static DistillationResult storeUnavailable() {
    return new DistillationResult(true, true, 0, 0, 0);
  }

  /** True when the pass ran and could not reach the store. Item-level failures do not count. */
  public boolean isFailure() {
    return storeFailed;
  }
}
