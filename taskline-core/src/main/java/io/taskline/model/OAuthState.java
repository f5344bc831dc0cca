package io.taskline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A pending OAuth authorization {@code state} value.
 *
 * @param state     the random state token sent to the provider
 * @param ownerId   owner who started the authorization
 * @param provider  identity provider name
 * @param createdAt creation time
 * @param expiresAt time after which the state is rejected
 */
public record OAuthState(String state, String ownerId, String provider, Instant createdAt, Instant expiresAt) {

  public OAuthState {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
