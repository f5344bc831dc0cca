package io.taskline.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * An OAuth credential for one {@code (owner, provider)} pair.
 *
 * @param ownerId      owner of the credential
 * @param provider     identity provider name
 * @param accessToken  current access token
 * @param refreshToken refresh token, or {@code null} if none was issued or it was revoked
 * @param expiresAt    access token expiry
 * @param scope        granted scopes
 * @param status       lifecycle status
 * @param updatedAt    time of the last write
 */
public record Credential(
    String ownerId,
    String provider,
    String accessToken,
    String refreshToken,
    Instant expiresAt,
    Set<String> scope,
    CredentialStatus status,
    Instant updatedAt) {

  public Credential {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(expiresAt, "expiresAt");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(updatedAt, "updatedAt");
    scope = scope == null ? Set.of() : Set.copyOf(scope);
  }

  public CredentialKey key() {
    return new CredentialKey(ownerId, provider);
  }

  /**
   * Returns {@code true} if the access token stays valid for more than {@code margin} after {@code now}.
   */
  public boolean isValidFor(Instant now, Duration margin) {
    return expiresAt.isAfter(now.plus(margin));
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public Credential withStatus(CredentialStatus newStatus, Instant at) {
    return new Credential(ownerId, provider, accessToken, refreshToken, expiresAt, scope, newStatus, at);
  }

  public Credential withTokens(String newAccessToken, String newRefreshToken, Instant newExpiresAt,
      Set<String> newScope, Instant at) {
    return new Credential(ownerId, provider, newAccessToken, newRefreshToken, newExpiresAt,
        newScope, CredentialStatus.ACTIVE, at);
  }

  @Override
  public String toString() {
    return "Credential{" + ownerId + "/" + provider + ", status=" + status + ", expiresAt=" + expiresAt + "}";
  }
}
