package io.taskline.oauth;

import io.taskline.TasklineException;
import io.taskline.model.OAuthState;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.OAuthStateStore;

import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues and checks the {@code state} parameter of the OAuth authorization-code flow.
 *
 * <p>A state is 32 random bytes encoded as URL-safe Base64 without padding. It is bound
 * to the owner and provider that started the flow, expires after a short time to live
 * and can be validated once.
 */
public final class OAuthStateManager {
  private static final Logger logger = Logger.getLogger(OAuthStateManager.class.getName());
  private static final int STATE_BYTES = 32;

  private final ConnectionProvider connectionProvider;
  private final OAuthStateStore stateStore;
  private final Clock clock;
  private final Duration ttl;
  private final SecureRandom random;

  private OAuthStateManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore");
    if (builder.ttl.isNegative() || builder.ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.ttl = builder.ttl;
    this.random = builder.random != null ? builder.random : new SecureRandom();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates and stores a state for an authorization request.
   *
   * @param ownerId  the owner starting the flow
   * @param provider the identity provider
   * @return the state value to send to the provider
   */
  public String generateState(String ownerId, String provider) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(provider, "provider");
    byte[] bytes = new byte[STATE_BYTES];
    random.nextBytes(bytes);
    String state = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    Instant now = clock.instant();
    OAuthState record = new OAuthState(state, ownerId, provider, now, now.plus(ttl));
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      stateStore.insert(conn, record);
    } catch (SQLException e) {
      throw new TasklineException("Failed to store OAuth state", e);
    }
    return state;
  }

  /**
   * Consumes a state returned by the provider callback.
   *
   * @param state    the returned state value
   * @param provider the provider handling the callback
   * @return the owner who started the flow, or empty if the state is unknown, already
   *     used, expired or was issued for another provider
   */
  public Optional<String> validateState(String state, String provider) {
    if (state == null || state.isEmpty()) {
      return Optional.empty();
    }
    Optional<OAuthState> consumed;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      consumed = stateStore.consume(conn, state);
    } catch (SQLException e) {
      throw new TasklineException("Failed to consume OAuth state", e);
    }
    if (consumed.isEmpty()) {
      logger.log(Level.WARNING, "Rejected unknown or already used OAuth state for provider {0}", provider);
      return Optional.empty();
    }
    OAuthState found = consumed.get();
    if (found.isExpired(clock.instant())) {
      logger.log(Level.WARNING, "Rejected expired OAuth state for {0}/{1}",
          new Object[]{found.ownerId(), found.provider()});
      return Optional.empty();
    }
    if (!found.provider().equals(provider)) {
      logger.log(Level.WARNING, "Rejected OAuth state issued for {0} on a {1} callback",
          new Object[]{found.provider(), provider});
      return Optional.empty();
    }
    return Optional.of(found.ownerId());
  }

  /**
   * Deletes expired states.
   *
   * @param now the cutoff
   * @return the number of states deleted
   */
  public int cleanupExpired(Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return stateStore.purgeExpired(conn, now);
    } catch (SQLException e) {
      throw new TasklineException("Failed to purge expired OAuth states", e);
    }
  }

  public int cleanupExpired() {
    return cleanupExpired(clock.instant());
  }

  /** Builder for {@link OAuthStateManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OAuthStateStore stateStore;
    private Clock clock;
    private Duration ttl = Duration.ofMinutes(10);
    private SecureRandom random;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder stateStore(OAuthStateStore stateStore) {
      this.stateStore = stateStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long a state stays valid.
     *
     * <p>Optional. Defaults to 10 minutes.
     */
    public Builder ttl(Duration ttl) {
      this.ttl = Objects.requireNonNull(ttl, "ttl");
      return this;
    }

    /**
     * Optional. Defaults to a new {@link SecureRandom}.
     */
    public Builder random(SecureRandom random) {
      this.random = random;
      return this;
    }

    public OAuthStateManager build() {
      return new OAuthStateManager(this);
    }
  }
}
