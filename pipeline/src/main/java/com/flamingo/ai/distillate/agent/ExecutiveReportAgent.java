package com.flamingo.ai.distillate.agent;

import com.flamingo.ai.distillate.agent.dto.ExecutiveReportDraft;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent synthesizing a batch of item summaries into a three-section executive report readable in
 * under three minutes.
 */
public interface ExecutiveReportAgent {

  @SystemMessage(
      """
        You are an expert AI industry analyst. Review the collection of recent AI news summaries
        and synthesize them into a highly concise, executive-level report designed to be read in
        under 3 minutes. Return a JSON object with three fields:

        1. "whatsNew": The most important general news and trends.

        2. "featureBriefSummary": Find the entries whose Source is exactly "{{featureSource}}" and
           give a comprehensive summary of that content. Organize it by the distinct topics
           discussed. For each topic write a main bullet ("* **Topic Name:** Description") and
           directly underneath it an indented sub-bullet
           ("  * So what does this mean in plain English: ...") explaining the impact and potential
           industry applications. If no entry comes from that source, say so in one bullet.

        3. "keyTakeaways": Actionable insights for professionals.

        Format the content of every field strictly as a markdown bulleted list using asterisks (*),
        with a newline between bullets. Never write a single paragraph.

        Return ONLY valid JSON matching this structure:
        {"whatsNew": "...", "featureBriefSummary": "...", "keyTakeaways": "..."}
        """)
  @UserMessage("""
        Raw summaries batch:
        {{summaries}}
        """)
  ExecutiveReportDraft synthesize(
      @V("featureSource") String featureSource, @V("summaries") String summaries);
}
