package com.flamingo.ai.ingestion.service.retry;

/** Callback invoked after a failed attempt, before waiting for the next one. */
@FunctionalInterface
public interface RetryListener {

  RetryListener NONE = (attempt, failure) -> {};

  /**
   * @param attempt number of the attempt that just failed, starting at 1
   * @param failure the failure that triggered the retry
   */
  void beforeRetry(int attempt, Throwable failure);
}
