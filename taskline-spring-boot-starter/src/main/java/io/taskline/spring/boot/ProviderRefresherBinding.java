package io.taskline.spring.boot;

import io.taskline.credential.ProviderRefresher;

import java.util.Objects;

/**
 * Binds a {@link ProviderRefresher} bean to the identity provider whose tokens it refreshes.
 *
 * @param provider the provider name, as stored with the credential
 * @param refresher the refresh call
 */
public record ProviderRefresherBinding(String provider, ProviderRefresher refresher) {

  public ProviderRefresherBinding {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(refresher, "refresher");
  }

  public static ProviderRefresherBinding of(String provider, ProviderRefresher refresher) {
    return new ProviderRefresherBinding(provider, refresher);
  }
}
