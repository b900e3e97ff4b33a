package com.flamingo.ai.distillate.service.distillation;

import com.flamingo.ai.distillate.agent.ItemDistillationAgent;
import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.exception.LlmServiceException;
import com.flamingo.ai.distillate.service.retry.RetryPolicy;
import com.flamingo.ai.distillate.service.retry.RetryingInvoker;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link DistillationService} using the item distillation agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistillationServiceImpl implements DistillationService {

  static final String RETRY_NAME = "llm.distillation";

  private final ItemDistillationAgent itemDistillationAgent;
  private final RetryingInvoker retryingInvoker;
  private final PipelineConfig pipelineConfig;

  @Override
  @Timed(value = "distillation.item", description = "Time to distill one item including retries")
  public ItemDistillation distill(String title, String text) {
    int maxInputChars = pipelineConfig.getDistillation().getMaxInputChars();
    String truncated = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
    log.debug(
        "Distilling '{}' (input {} chars, truncated to {})", title, text.length(), truncated.length());

    RetryPolicy policy = pipelineConfig.getDistillation().getRetry().toPolicy();
    try {
      return retryingInvoker.invoke(RETRY_NAME, policy, () -> callAgent(title, truncated));
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LlmServiceException(
          "Distillation of '" + title + "' failed after " + policy.maxAttempts() + " attempts", e);
    }
  }

  private ItemDistillation callAgent(String title, String text) {
    ItemDistillation result = itemDistillationAgent.distill(title, text);
    if (result == null || isBlank(result.category()) || isBlank(result.summary())) {
      throw new LlmServiceException("Distillation response is missing category or summary", true);
    }
    return new ItemDistillation(result.category().strip(), result.summary().strip());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
