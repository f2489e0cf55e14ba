package com.flamingo.ai.ingestion.service.retry;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs calls under a {@link RetryPolicy} using a Resilience4j {@link Retry}.
 *
 * <p>Every caller that retries against an external service goes through here, so waits, attempt
 * limits and logging behave the same for the topic classifier and the vector store. The worker
 * thread sleeps for the whole backoff.
 */
@Component
@Slf4j
public class RetryExecutor {

  public <T> T execute(String name, RetryPolicy policy, Supplier<T> action) {
    return execute(name, policy, action, RetryListener.NONE);
  }

  /**
   * Runs {@code action}, retrying failures accepted by the policy.
   *
   * @param name retry name used in logs
   * @param policy attempts, wait and retry predicate
   * @param action the call to run
   * @param listener notified before every retry, for example to rewrite the payload
   * @return the result of the first successful attempt
   * @throws RuntimeException the last failure when attempts are exhausted, or the first failure
   *     the policy does not retry
   */
  public <T> T execute(
      String name, RetryPolicy policy, Supplier<T> action, RetryListener listener) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(policy.maxAttempts())
            .waitDuration(policy.backoff())
            .retryOnException(policy.retryOn())
            .build();
    Retry retry = Retry.of(name, config);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              Throwable failure = event.getLastThrowable();
              log.warn(
                  "[{}] attempt {}/{} failed, retrying in {} ms: {}",
                  name,
                  event.getNumberOfRetryAttempts(),
                  policy.maxAttempts(),
                  policy.backoff().toMillis(),
                  failure != null ? failure.getMessage() : "unknown error");
              listener.beforeRetry(event.getNumberOfRetryAttempts(), failure);
            });
    return retry.executeSupplier(action);
  }
}
