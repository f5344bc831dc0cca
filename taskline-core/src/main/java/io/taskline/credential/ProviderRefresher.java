package io.taskline.credential;

/**
 * Exchanges a refresh token for a new access token at one identity provider.
 *
 * <p>Implementations perform the provider's HTTP token call. They must not touch
 * stored credentials; the {@link TokenRefreshManager} persists the returned grant.
 */
@FunctionalInterface
public interface ProviderRefresher {

  /**
   * Refreshes the access token.
   *
   * @param refreshToken the stored refresh token
   * @return the new grant
   * @throws ProviderRefreshException if the provider rejected the refresh token
   *     ({@link ProviderRefreshException.Reason#INVALID_GRANT}) or could not be reached
   *     ({@link ProviderRefreshException.Reason#TRANSIENT})
   */
  TokenGrant refresh(String refreshToken) throws ProviderRefreshException;
}
