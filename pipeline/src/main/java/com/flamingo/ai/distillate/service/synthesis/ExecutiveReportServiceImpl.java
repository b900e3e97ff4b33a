package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.agent.BriefingScriptAgent;
import com.flamingo.ai.distillate.agent.ExecutiveReportAgent;
import com.flamingo.ai.distillate.agent.dto.ExecutiveReportDraft;
import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.exception.LlmServiceException;
import com.flamingo.ai.distillate.service.retry.RetryPolicy;
import com.flamingo.ai.distillate.service.retry.RetryingInvoker;
import io.micrometer.core.annotation.Timed;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link ExecutiveReportService} using the report and script agents. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutiveReportServiceImpl implements ExecutiveReportService {

  static final String REPORT_RETRY_NAME = "llm.report";
  static final String SCRIPT_RETRY_NAME = "llm.script";

  private final ExecutiveReportAgent executiveReportAgent;
  private final BriefingScriptAgent briefingScriptAgent;
  private final RetryingInvoker retryingInvoker;
  private final PipelineConfig pipelineConfig;

  @Override
  @Timed(value = "synthesis.report", description = "Time to draft the executive report")
  public ExecutiveReportDraft draftReport(String summaryCorpus) {
    String featureSource = pipelineConfig.getSynthesis().getLiveBriefingSource();
    log.debug("Drafting report from {} chars of summaries", summaryCorpus.length());
    return withRetry(
        REPORT_RETRY_NAME,
        () -> {
          ExecutiveReportDraft draft = executiveReportAgent.synthesize(featureSource, summaryCorpus);
          if (draft == null
              || isBlank(draft.whatsNew())
              || isBlank(draft.featureBriefSummary())
              || isBlank(draft.keyTakeaways())) {
            throw new LlmServiceException("Report response is missing a section", true);
          }
          return draft;
        });
  }

  @Override
  @Timed(value = "synthesis.script", description = "Time to write the briefing script")
  public String writeScript(String rawCorpus) {
    PipelineConfig.Synthesis synthesis = pipelineConfig.getSynthesis();
    log.debug("Writing script from {} chars of articles", rawCorpus.length());
    return withRetry(
        SCRIPT_RETRY_NAME,
        () -> {
          String script =
              briefingScriptAgent.writeScript(
                  synthesis.getShowName(), synthesis.getScriptTargetWords(), rawCorpus);
          if (isBlank(script)) {
            throw new LlmServiceException("Script response is empty", true);
          }
          return script.strip();
        });
  }

  private <T> T withRetry(String name, Supplier<T> call) {
    RetryPolicy policy = pipelineConfig.getSynthesis().getRetry().toPolicy();
    try {
      return retryingInvoker.invoke(name, policy, call);
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LlmServiceException(name + " failed after " + policy.maxAttempts() + " attempts", e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
