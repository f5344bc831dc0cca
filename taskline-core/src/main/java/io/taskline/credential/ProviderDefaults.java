package io.taskline.credential;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Access token lifetimes assumed when a provider omits {@code expires_in}.
 */
public final class ProviderDefaults {
  public static final Duration DEFAULT_LIFETIME = Duration.ofHours(1);

  private static final Map<String, Duration> LIFETIMES = Map.of(
      "facebook", Duration.ofDays(60),
      "instagram", Duration.ofDays(60),
      "linkedin", Duration.ofDays(60),
      "twitter", Duration.ofHours(2),
      "zoho", Duration.ofHours(1));

  private ProviderDefaults() {
  }

  /**
   * @param provider provider name, case-insensitive
   * @return the provider's usual token lifetime, or {@link #DEFAULT_LIFETIME}
   */
  public static Duration lifetime(String provider) {
    if (provider == null) {
      return DEFAULT_LIFETIME;
    }
    return LIFETIMES.getOrDefault(provider.toLowerCase(Locale.ROOT), DEFAULT_LIFETIME);
  }
}
