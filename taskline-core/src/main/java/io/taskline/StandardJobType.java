package io.taskline;

import java.util.Locale;

/**
 * Job types known to the marketing backend.
 *
 * <p>{@link #TOKEN_REFRESH} and {@link #CLEANUP} have built-in handlers in
 * {@link io.taskline.jobs}. The others are executed by application handlers.
 */
public enum StandardJobType implements JobType {
  SCHEDULED_POST,
  EMAIL_CAMPAIGN,
  TOKEN_REFRESH,
  ANALYTICS_SYNC,
  CLEANUP;

  private final String key = name().toLowerCase(Locale.ROOT);

  /**
   * Returns the lower-case persisted key, e.g. {@code "scheduled_post"}.
   */
  @Override
  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return key;
  }
}
