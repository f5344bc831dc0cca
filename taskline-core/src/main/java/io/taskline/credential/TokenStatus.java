package io.taskline.credential;

import io.taskline.model.CredentialStatus;

import java.time.Instant;

/**
 * Health of one credential as reported to the owner.
 *
 * @param provider     identity provider name
 * @param status       stored status
 * @param expiresAt    access token expiry
 * @param expired      {@code true} if the access token has expired
 * @param expiringSoon {@code true} if it expires within the configured window
 */
public record TokenStatus(
    String provider,
    CredentialStatus status,
    Instant expiresAt,
    boolean expired,
    boolean expiringSoon) {

  public boolean reauthorizationRequired() {
    return status == CredentialStatus.REVOKED;
  }
}
