package io.taskline;

/**
 * Classification of a job failure. Drives the retry-or-terminal decision.
 */
public enum ErrorKind {
  /** Network failure, timeout, rate limit. Retried with backoff until attempts run out. */
  TRANSIENT,
  /** Malformed payload, unknown job type, business-rule rejection. Failed without retry. */
  PERMANENT,
  /** Credential expired and unrefreshable, or revoked. Failed without retry; owner must re-authorize. */
  AUTH;

  public boolean isRetryable() {
    return this == TRANSIENT;
  }
}
