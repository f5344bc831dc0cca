package io.taskline.scheduler;

/**
 * Computes how long a job waits before its next attempt after a retryable failure.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts dispatches made so far (1 after the first failure)
   * @return delay in milliseconds before the job becomes due again
   */
  long computeDelayMs(int attempts);
}
