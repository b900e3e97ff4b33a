package com.flamingo.ai.distillate.service.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;

/**
 * Bounded exponential backoff for one external call site.
 *
 * <p>The wait before retry {@code n} (1-based) is {@code baseDelay * 2^(n-1)}, clamped to {@code
 * [minDelay, maxDelay]}. The call is attempted at most {@code maxAttempts} times in total.
 *
 * @param maxAttempts total attempts including the first call, at least 1
 * @param baseDelay the unclamped delay before the first retry
 * @param minDelay the floor of every delay
 * @param maxDelay the ceiling of every delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration minDelay, Duration maxDelay) {

  private static final Duration SMALLEST_INTERVAL = Duration.ofMillis(1);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
    }
    if (baseDelay == null || minDelay == null || maxDelay == null) {
      throw new IllegalArgumentException("Retry delays must not be null");
    }
    if (minDelay.compareTo(maxDelay) > 0) {
      throw new IllegalArgumentException(
          "minDelay " + minDelay + " must not exceed maxDelay " + maxDelay);
    }
  }

  /** Single attempt, no retry. */
  public static RetryPolicy none() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, Duration.ZERO);
  }

  /**
   * Delay to wait after the given failed attempt.
   *
   * @param attempt 1-based number of the attempt that just failed
   * @return the clamped backoff delay
   */
  public Duration delayAfterAttempt(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be at least 1, was " + attempt);
    }
    long base = baseDelay.toMillis();
    int exponent = Math.min(attempt - 1, 30);
    double unclamped = base * Math.pow(2, exponent);
    long millis = (long) Math.min(unclamped, (double) maxDelay.toMillis());
    millis = Math.max(millis, minDelay.toMillis());
    return Duration.ofMillis(millis);
  }

  /** Builds the Resilience4j configuration that applies this policy. */
  public RetryConfig toRetryConfig() {
    IntervalFunction backoff =
        attempt -> Math.max(SMALLEST_INTERVAL.toMillis(), delayAfterAttempt(attempt).toMillis());
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(backoff)
        .retryExceptions(RuntimeException.class)
        .build();
  }
}
