package io.taskline.credential;

import io.taskline.model.CredentialKey;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of refreshing one credential during a sweep.
 *
 * @param key       the credential
 * @param status    what happened
 * @param expiresAt expiry after the sweep, {@code null} when the refresh failed
 * @param error     failure detail for {@link Status#FAILED} and {@link Status#REVOKED}
 */
public record RefreshOutcome(CredentialKey key, Status status, Instant expiresAt, String error) {

  public enum Status {
    /** The provider issued a new token. */
    REFRESHED,
    /** Another caller refreshed the credential first; no provider call was made. */
    ALREADY_FRESH,
    /** The refresh failed transiently; the credential was marked expiring. */
    FAILED,
    /** The credential is revoked and needs re-authorization. */
    REVOKED
  }

  public RefreshOutcome {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
  }
}
