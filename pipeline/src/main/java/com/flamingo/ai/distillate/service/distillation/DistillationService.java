package com.flamingo.ai.distillate.service.distillation;

import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import com.flamingo.ai.distillate.exception.LlmServiceException;

/** Service turning one item's text into a category and a condensed summary. */
public interface DistillationService {

  /**
   * Distills the text, retrying transient and malformed responses.
   *
   * @param title item title, given to the model as context
   * @param text non-blank item text
   * @return a distillation with non-blank category and summary
   * @throws LlmServiceException once all attempts failed
   */
  ItemDistillation distill(String title, String text);
}
