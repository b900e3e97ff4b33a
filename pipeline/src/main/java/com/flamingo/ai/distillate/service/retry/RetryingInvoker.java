package com.flamingo.ai.distillate.service.retry;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs external calls under an explicit {@link RetryPolicy}.
 *
 * <p>Each call site is identified by a name; the Resilience4j {@link Retry} instance for that name
 * is created on first use from the supplied policy and reused afterwards, so its metrics accumulate
 * across calls. Backoff sleeps block the calling thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryingInvoker {

  private final RetryRegistry retryRegistry;

  /**
   * Invokes the call, retrying on any runtime exception until the policy is exhausted.
   *
   * @param name call site name, e.g. {@code "llm.distillation"}
   * @param policy the retry policy of this call site
   * @param call the external call
   * @return the first successful result
   * @throws RuntimeException the exception of the last attempt once all attempts failed
   */
  public <T> T invoke(String name, RetryPolicy policy, Supplier<T> call) {
    Retry retry = retryFor(name, policy);
    return Retry.decorateSupplier(retry, call).get();
  }

  private Retry retryFor(String name, RetryPolicy policy) {
    return retryRegistry
        .find(name)
        .orElseGet(
            () -> {
              Retry created = retryRegistry.retry(name, policy.toRetryConfig());
              created
                  .getEventPublisher()
                  .onRetry(
                      event ->
                          log.warn(
                              "{} attempt {}/{} failed, retrying in {} ms: {}",
                              name,
                              event.getNumberOfRetryAttempts(),
                              policy.maxAttempts(),
                              event.getWaitInterval().toMillis(),
                              event.getLastThrowable() != null
                                  ? event.getLastThrowable().getMessage()
                                  : "unknown error"));
              return created;
            });
  }
}
