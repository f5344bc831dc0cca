package io.taskline.scheduler;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * 2^attempts, maxDelay)}, scaled by a random
 * factor in [0.5, 1.5) and capped again at {@code maxDelay}. The jitter spreads out
 * retries of jobs that failed together.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 5_000;
  public static final long DEFAULT_MAX_DELAY_MS = 3_600_000;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay unit (milliseconds); the first retry waits about twice this
   * @param maxDelayMs  maximum delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    long capped = cappedDelayMs(attempts);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }

  /**
   * Returns the delay before jitter: {@code min(baseDelay * 2^attempts, maxDelay)}.
   */
  long cappedDelayMs(int attempts) {
    if (attempts <= 0) {
      return baseDelayMs;
    }
    if (attempts >= 62) {
      return maxDelayMs;
    }
    long factor = 1L << attempts;
    // baseDelayMs * factor would overflow or exceed the cap
    if (factor > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * factor);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
