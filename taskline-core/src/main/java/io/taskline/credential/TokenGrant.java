package io.taskline.credential;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Tokens returned by a provider refresh.
 *
 * @param accessToken  the new access token
 * @param refreshToken a rotated refresh token, or {@code null} to keep the current one
 * @param expiresIn    lifetime of the access token, or {@code null} to use
 *                     {@link ProviderDefaults#lifetime(String)}
 * @param scope        granted scopes, or {@code null} to keep the current ones
 */
public record TokenGrant(String accessToken, String refreshToken, Duration expiresIn, Set<String> scope) {

  public TokenGrant {
    Objects.requireNonNull(accessToken, "accessToken");
    if (expiresIn != null && (expiresIn.isNegative() || expiresIn.isZero())) {
      throw new IllegalArgumentException("expiresIn must be positive");
    }
    scope = scope == null ? null : Set.copyOf(scope);
  }

  public static TokenGrant of(String accessToken, Duration expiresIn) {
    return new TokenGrant(accessToken, null, expiresIn, null);
  }

  @Override
  public String toString() {
    return "TokenGrant{expiresIn=" + expiresIn + ", rotated=" + (refreshToken != null) + "}";
  }
}
