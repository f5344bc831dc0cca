package io.taskline;

import java.util.Objects;

/**
 * Thrown when a valid access token cannot be produced for an {@code (owner, provider)} pair.
 *
 * <p>When {@link #reauthorizationRequired()} is {@code true} the credential is missing,
 * revoked, or its refresh token was rejected by the provider; nothing will succeed
 * until the owner authorizes again. Jobs failing with such an exception are marked
 * failed with {@link ErrorKind#AUTH} and are not retried.
 *
 * <p>When it is {@code false} the provider call failed transiently and the
 * credential is still usable on a later attempt.
 */
public class AuthException extends RuntimeException {
  private final String ownerId;
  private final String provider;
  private final boolean reauthorizationRequired;

  public AuthException(String ownerId, String provider, boolean reauthorizationRequired, String message) {
    this(ownerId, provider, reauthorizationRequired, message, null);
  }

  public AuthException(String ownerId, String provider, boolean reauthorizationRequired,
      String message, Throwable cause) {
    super(message, cause);
    this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
    this.provider = Objects.requireNonNull(provider, "provider");
    this.reauthorizationRequired = reauthorizationRequired;
  }

  /**
   * Creates an exception signalling that the owner must authorize the provider again.
   */
  public static AuthException reauthorizationRequired(String ownerId, String provider, String message) {
    return new AuthException(ownerId, provider, true, message);
  }

  public String ownerId() {
    return ownerId;
  }

  public String provider() {
    return provider;
  }

  public boolean reauthorizationRequired() {
    return reauthorizationRequired;
  }
}
