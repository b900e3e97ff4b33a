package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.agent.dto.ExecutiveReportDraft;
import com.flamingo.ai.distillate.exception.LlmServiceException;

/** Service producing the written report and the spoken script of one synthesis. */
public interface ExecutiveReportService {

  /**
   * Writes the three report sections from the summary corpus.
   *
   * @throws LlmServiceException once all attempts failed or every response was incomplete
   */
  ExecutiveReportDraft draftReport(String summaryCorpus);

  /**
   * Writes the spoken briefing script from the raw-text corpus.
   *
   * @throws LlmServiceException once all attempts failed or every response was blank
   */
  String writeScript(String rawCorpus);
}
