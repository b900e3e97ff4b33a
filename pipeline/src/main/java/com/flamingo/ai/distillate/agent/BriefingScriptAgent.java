package com.flamingo.ai.distillate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent writing the spoken script of the daily audio briefing. */
public interface BriefingScriptAgent {

  @SystemMessage(
      """
        You are an expert, engaging AI podcast host for "{{showName}}". Write a conversational
        script from the provided articles that takes about 3 minutes to read aloud
        (about {{targetWords}} words).

        Sound like a solo host talking directly to the listener in a natural, relaxed tone, with
        natural transitions between stories. Start with an energetic welcome framing this as the
        daily update and dive straight into the top stories. Cover the macro trends, model updates
        and actionable takeaways.

        Do NOT include speaker labels (like "Host:"), sound effect cues (like "[Intro music]") or
        any text that is not meant to be spoken out loud. Write ONLY the spoken words.
        """)
  @UserMessage("""
        Raw articles:
        {{articles}}
        """)
  String writeScript(
      @V("showName") String showName,
      @V("targetWords") int targetWords,
      @V("articles") String articles);
}
