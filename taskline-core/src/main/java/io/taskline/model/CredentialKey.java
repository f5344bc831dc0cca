package io.taskline.model;

import java.util.Objects;

/**
 * Identity of a stored credential.
 *
 * @param ownerId  owner of the credential
 * @param provider identity provider name, e.g. {@code "linkedin"}
 */
public record CredentialKey(String ownerId, String provider) {

  public CredentialKey {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(provider, "provider");
  }

  @Override
  public String toString() {
    return ownerId + "/" + provider;
  }
}
