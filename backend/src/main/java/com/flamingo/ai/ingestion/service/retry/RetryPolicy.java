package com.flamingo.ai.ingestion.service.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with a fixed wait between attempts.
 *
 * @param maxAttempts total attempts including the first call
 * @param backoff fixed wait before each retry
 * @param retryOn failures worth another attempt; anything else is rethrown immediately
 */
public record RetryPolicy(int maxAttempts, Duration backoff, Predicate<Throwable> retryOn) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    backoff = backoff == null ? Duration.ZERO : backoff;
  }
}
