package com.flamingo.ai.distillate.config;

import com.flamingo.ai.distillate.agent.BriefingScriptAgent;
import com.flamingo.ai.distillate.agent.ExecutiveReportAgent;
import com.flamingo.ai.distillate.agent.ItemDistillationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline's AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Per-item category and summary extraction. Uses the JSON-mode chat model. */
  @Bean
  public ItemDistillationAgent itemDistillationAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(ItemDistillationAgent.class).chatModel(chatModel).build();
  }

  /** Three-section executive report over a batch of summaries. Uses the JSON-mode chat model. */
  @Bean
  public ExecutiveReportAgent executiveReportAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(ExecutiveReportAgent.class).chatModel(chatModel).build();
  }

  /**
   * Spoken briefing script writer. Uses textChatModel (no JSON response format) for free-form text
   * output.
   */
  @Bean
  public BriefingScriptAgent briefingScriptAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(BriefingScriptAgent.class).chatModel(textChatModel).build();
  }
}
