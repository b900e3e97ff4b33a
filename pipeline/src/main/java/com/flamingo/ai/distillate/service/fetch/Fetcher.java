package com.flamingo.ai.distillate.service.fetch;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.exception.FetchException;
import com.flamingo.ai.distillate.service.retry.RetryPolicy;
import com.flamingo.ai.distillate.service.retry.RetryingInvoker;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Retrieves the text of a URL with a browser-like user agent, following redirects.
 *
 * <p>Non-2xx responses, timeouts and connection errors are transient and retried under the
 * configured fetch policy.
 */
@Component
@Slf4j
public class Fetcher {

  static final String RETRY_NAME = "fetch";

  private final WebClient webClient;
  private final RetryingInvoker retryingInvoker;
  private final RetryPolicy policy;
  private final Duration timeout;

  public Fetcher(
      @Qualifier("fetchWebClient") WebClient webClient,
      RetryingInvoker retryingInvoker,
      PipelineConfig pipelineConfig) {
    this.webClient = webClient;
    this.retryingInvoker = retryingInvoker;
    this.policy = pipelineConfig.getFetch().getRetry().toPolicy();
    this.timeout = pipelineConfig.getFetch().getTimeout();
  }

  /**
   * Fetches the body of the given URL as text.
   *
   * @throws FetchException once every attempt failed
   */
  @Timed(value = "fetch.request", description = "Time to fetch a URL including retries")
  public String fetch(String url) {
    try {
      return retryingInvoker.invoke(RETRY_NAME, policy, () -> fetchOnce(url));
    } catch (FetchException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Giving up on {} after {} attempts: {}", url, policy.maxAttempts(), e.getMessage());
      throw new FetchException(
          url, "Failed to fetch " + url + " after " + policy.maxAttempts() + " attempts", e);
    }
  }

  private String fetchOnce(String url) {
    String body = webClient.get().uri(url).retrieve().bodyToMono(String.class).block(timeout);
    return body != null ? body : "";
  }
}
