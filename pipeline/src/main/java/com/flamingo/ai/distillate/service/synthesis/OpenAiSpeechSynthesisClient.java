package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.exception.SpeechSynthesisException;
import com.flamingo.ai.distillate.service.retry.RetryPolicy;
import com.flamingo.ai.distillate.service.retry.RetryingInvoker;
import io.micrometer.core.annotation.Timed;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** {@link SpeechSynthesisClient} calling the OpenAI {@code audio/speech} endpoint. */
@Component
@Slf4j
public class OpenAiSpeechSynthesisClient implements SpeechSynthesisClient {

  static final String RETRY_NAME = "speech";

  /** Longest input the endpoint accepts. */
  static final int MAX_INPUT_CHARS = 4_096;

  private final WebClient webClient;
  private final RetryingInvoker retryingInvoker;
  private final PipelineConfig.Speech speech;

  public OpenAiSpeechSynthesisClient(
      @Qualifier("speechWebClient") WebClient webClient,
      RetryingInvoker retryingInvoker,
      PipelineConfig pipelineConfig) {
    this.webClient = webClient;
    this.retryingInvoker = retryingInvoker;
    this.speech = pipelineConfig.getSpeech();
  }

  @Override
  @Timed(value = "synthesis.speech", description = "Time to render the script to audio")
  public byte[] synthesize(String script) {
    if (speech.getApiKey() == null || speech.getApiKey().isBlank()) {
      throw new SpeechSynthesisException(
          "Speech API key is required. Set OPENAI_API_KEY environment variable.");
    }
    String input = script;
    if (input.length() > MAX_INPUT_CHARS) {
      log.warn("Script of {} chars truncated to {} for speech synthesis", input.length(), MAX_INPUT_CHARS);
      input = input.substring(0, MAX_INPUT_CHARS);
    }
    Map<String, String> body =
        Map.of(
            "model", speech.getModel(),
            "voice", speech.getVoice(),
            "input", input,
            "response_format", "mp3");

    RetryPolicy policy = speech.getRetry().toPolicy();
    byte[] audio;
    try {
      audio = retryingInvoker.invoke(RETRY_NAME, policy, () -> post(body));
    } catch (RuntimeException e) {
      throw new SpeechSynthesisException(
          "Speech synthesis failed after " + policy.maxAttempts() + " attempts: " + e.getMessage(), e);
    }
    if (audio == null || audio.length == 0) {
      throw new SpeechSynthesisException("Speech synthesis returned no audio");
    }
    log.debug("Synthesized {} bytes of audio", audio.length);
    return audio;
  }

  private byte[] post(Map<String, String> body) {
    return webClient
        .post()
        .uri("/audio/speech")
        .headers(headers -> headers.setBearerAuth(speech.getApiKey()))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.ALL)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(byte[].class)
        .block(speech.getTimeout());
  }
}
