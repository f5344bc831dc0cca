package io.taskline.credential;

import java.util.Objects;

/**
 * Thrown by a {@link ProviderRefresher} when the provider's token call fails.
 */
public class ProviderRefreshException extends Exception {

  /** Failure classification. */
  public enum Reason {
    /** Network error, rate limit or provider outage; the refresh token is still valid. */
    TRANSIENT,
    /** The provider rejected the refresh token; the owner must authorize again. */
    INVALID_GRANT
  }

  private final Reason reason;

  public ProviderRefreshException(Reason reason, String message) {
    this(reason, message, null);
  }

  public ProviderRefreshException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public static ProviderRefreshException invalidGrant(String message) {
    return new ProviderRefreshException(Reason.INVALID_GRANT, message);
  }

  public static ProviderRefreshException transientFailure(String message, Throwable cause) {
    return new ProviderRefreshException(Reason.TRANSIENT, message, cause);
  }

  public Reason reason() {
    return reason;
  }
}
