package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.domain.entity.Item;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders batch items as the tagged text corpora sent to the language model. */
@Component
@RequiredArgsConstructor
public class CorpusBuilder {

  private final PipelineConfig pipelineConfig;

  /** One block per item with its distilled summary; input of the executive report. */
  public String summaryCorpus(List<Item> items) {
    StringBuilder corpus = new StringBuilder();
    for (Item item : items) {
      appendHeader(corpus, item);
      corpus.append("Summary: ").append(nullToEmpty(item.getSummary())).append("\n\n");
    }
    return corpus.toString();
  }

  /** One block per item with its raw text, falling back to the summary; input of the script. */
  public String rawCorpus(List<Item> items) {
    int cap = pipelineConfig.getSynthesis().getMaxCorpusEntryChars();
    StringBuilder corpus = new StringBuilder();
    for (Item item : items) {
      String text = item.hasBlankText() ? nullToEmpty(item.getSummary()) : item.getRawText();
      if (text.length() > cap) {
        text = text.substring(0, cap);
      }
      appendHeader(corpus, item);
      corpus.append("Content: ").append(text).append("\n\n");
    }
    return corpus.toString();
  }

  private static void appendHeader(StringBuilder corpus, Item item) {
    corpus.append("Source: ").append(item.getSource()).append('\n');
    corpus.append("Title: ").append(item.getTitle()).append('\n');
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
