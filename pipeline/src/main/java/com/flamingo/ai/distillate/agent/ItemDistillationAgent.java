package com.flamingo.ai.distillate.agent;

import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent categorizing one item and condensing it for professionals. */
public interface ItemDistillationAgent {

  @SystemMessage(
      """
        You process news content for busy professionals. For the provided text:

        1. "category": Categorize the text into a specific industry or use case
           (e.g. Healthcare, Software Eng, Finance). Use a short label, not a sentence.

        2. "summary": A highly condensed, 3-sentence summary highlighting only the most
           relevant, applicable information for professionals.

        Return ONLY valid JSON matching this structure:
        {"category": "...", "summary": "..."}
        """)
  @UserMessage("""
        Title: {{title}}

        Text to process:
        {{text}}
        """)
  ItemDistillation distill(@V("title") String title, @V("text") String text);
}
