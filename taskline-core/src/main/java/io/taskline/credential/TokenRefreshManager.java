package io.taskline.credential;

import io.taskline.AuthException;
import io.taskline.TasklineException;
import io.taskline.model.Credential;
import io.taskline.model.CredentialKey;
import io.taskline.model.CredentialStatus;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.CredentialStore;
import io.taskline.spi.MetricsExporter;
import io.taskline.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps OAuth access tokens valid: refreshes them on demand and proactively.
 *
 * <p>{@link #getValidToken(String, String)} returns the stored access token while it stays
 * valid for longer than the safety margin, and refreshes it synchronously otherwise.
 * {@link #sweepExpiring(Duration)} refreshes every credential expiring within a threshold
 * on a bounded pool.
 *
 * <p>Refreshes of the same {@code (owner, provider)} pair are serialized by a per-pair
 * lock. A caller that obtains the lock re-reads the credential first; if another caller
 * refreshed it while it waited, the stored credential is returned and the provider is not
 * called. Two concurrent sweeps therefore cost one provider call and observe the same
 * expiry.
 *
 * <p>A refresh token rejected by the provider marks the credential
 * {@link CredentialStatus#REVOKED} and raises an {@link AuthException} requiring
 * re-authorization. Transient provider failures raise an {@code AuthException} that does
 * not, and leave the stored credential usable.
 *
 * @see TokenRefreshManager.Builder
 */
public final class TokenRefreshManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TokenRefreshManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CredentialStore credentialStore;
  private final Map<String, ProviderRefresher> refreshers;
  private final Clock clock;
  private final Duration safetyMargin;
  private final Duration expiringSoonWindow;
  private final MetricsExporter metrics;
  private final ExecutorService sweepPool;
  final KeyedLocks<CredentialKey> locks = new KeyedLocks<>();

  private TokenRefreshManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.credentialStore = Objects.requireNonNull(builder.credentialStore, "credentialStore");
    if (builder.sweepConcurrency <= 0) {
      throw new IllegalArgumentException("sweepConcurrency must be > 0");
    }
    if (builder.safetyMargin.isNegative()) {
      throw new IllegalArgumentException("safetyMargin must be >= 0");
    }
    if (builder.expiringSoonWindow.isNegative()) {
      throw new IllegalArgumentException("expiringSoonWindow must be >= 0");
    }
    this.refreshers = Map.copyOf(builder.refreshers);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.safetyMargin = builder.safetyMargin;
    this.expiringSoonWindow = builder.expiringSoonWindow;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sweepPool = Executors.newFixedThreadPool(builder.sweepConcurrency,
        new DaemonThreadFactory("taskline-refresh-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns an access token valid for longer than the safety margin, refreshing it first
   * if needed.
   *
   * @param ownerId  the owner
   * @param provider the identity provider
   * @return a usable access token
   * @throws AuthException if no credential is stored, it is revoked, the refresh token was
   *     rejected ({@code reauthorizationRequired() == true}), or the provider failed
   *     transiently ({@code reauthorizationRequired() == false})
   * @throws TasklineException if the store cannot be reached
   */
  public String getValidToken(String ownerId, String provider) {
    Credential credential = requireUsable(ownerId, provider);
    if (credential.isValidFor(clock.instant(), safetyMargin)) {
      return credential.accessToken();
    }
    return refreshUnderLock(credential, safetyMargin).credential().accessToken();
  }

  /**
   * Refreshes the credential now, regardless of its expiry. Returns the stored credential
   * without calling the provider if another caller refreshed it concurrently.
   *
   * @return the refreshed credential
   * @throws AuthException as for {@link #getValidToken(String, String)}
   */
  public Credential refresh(String ownerId, String provider) {
    return refreshUnderLock(requireUsable(ownerId, provider), null).credential();
  }

  /**
   * Refreshes every ACTIVE or EXPIRING credential expiring within {@code threshold},
   * including already expired ones. One credential failing never stops the others.
   *
   * @param threshold refresh credentials with {@code expires_at <= now + threshold}
   * @return the per-credential outcomes
   * @throws TasklineException if the expiring credentials cannot be listed
   */
  public SweepReport sweepExpiring(Duration threshold) {
    Objects.requireNonNull(threshold, "threshold");
    Instant cutoff = clock.instant().plus(threshold);
    List<Credential> expiring = withConnection("list expiring credentials",
        conn -> credentialStore.listExpiring(conn, cutoff));
    if (expiring.isEmpty()) {
      return new SweepReport(List.of());
    }

    List<Future<RefreshOutcome>> futures = new ArrayList<>(expiring.size());
    for (Credential credential : expiring) {
      futures.add(sweepPool.submit(() -> sweepOne(credential, threshold)));
    }
    List<RefreshOutcome> outcomes = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        outcomes.add(futures.get(i).get());
      } catch (InterruptedException e) {
        futures.forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new TasklineException("Credential sweep interrupted", e);
      } catch (ExecutionException e) {
        Credential credential = expiring.get(i);
        logger.log(Level.WARNING, "Refresh of " + credential.key() + " failed unexpectedly", e.getCause());
        outcomes.add(new RefreshOutcome(credential.key(), RefreshOutcome.Status.FAILED, null,
            String.valueOf(e.getCause())));
      }
    }
    SweepReport report = new SweepReport(outcomes);
    logger.log(Level.INFO, "Credential sweep finished: {0}", report.toJson());
    return report;
  }

  private RefreshOutcome sweepOne(Credential observed, Duration threshold) {
    CredentialKey key = observed.key();
    try {
      Refresh refresh = refreshUnderLock(observed, threshold);
      RefreshOutcome.Status status = refresh.providerCalled()
          ? RefreshOutcome.Status.REFRESHED : RefreshOutcome.Status.ALREADY_FRESH;
      return new RefreshOutcome(key, status, refresh.credential().expiresAt(), null);
    } catch (AuthException e) {
      if (e.reauthorizationRequired()) {
        return new RefreshOutcome(key, RefreshOutcome.Status.REVOKED, null, e.getMessage());
      }
      markExpiring(key);
      return new RefreshOutcome(key, RefreshOutcome.Status.FAILED, null, e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Refresh of " + key + " failed", e);
      return new RefreshOutcome(key, RefreshOutcome.Status.FAILED, null, e.getMessage());
    }
  }

  /**
   * Lists the owner's credentials with their expiry state.
   */
  public List<TokenStatus> tokenStatus(String ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant now = clock.instant();
    List<Credential> credentials = withConnection("list credentials",
        conn -> credentialStore.listByOwner(conn, ownerId));
    List<TokenStatus> statuses = new ArrayList<>(credentials.size());
    for (Credential credential : credentials) {
      statuses.add(new TokenStatus(credential.provider(), credential.status(), credential.expiresAt(),
          credential.isExpired(now), !credential.isValidFor(now, expiringSoonWindow)));
    }
    return statuses;
  }

  /**
   * Stores a credential obtained from an authorization-code exchange, replacing any
   * previous (possibly revoked) one.
   */
  public void saveAuthorization(Credential credential) {
    Objects.requireNonNull(credential, "credential");
    withConnection("store credential", conn -> {
      credentialStore.upsert(conn, credential);
      return null;
    });
    logger.log(Level.INFO, "Stored authorization for {0}", credential.key());
  }

  private Credential requireUsable(String ownerId, String provider) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(provider, "provider");
    Optional<Credential> stored = withConnection("read credential",
        conn -> credentialStore.get(conn, ownerId, provider));
    if (stored.isEmpty()) {
      throw AuthException.reauthorizationRequired(ownerId, provider,
          "No credential stored for " + ownerId + "/" + provider);
    }
    if (stored.get().status() == CredentialStatus.REVOKED) {
      throw AuthException.reauthorizationRequired(ownerId, provider,
          "Credential for " + ownerId + "/" + provider + " is revoked");
    }
    return stored.get();
  }

  /**
   * @param threshold skip the refresh if the credential is valid beyond this, or
   *                  {@code null} to refresh regardless of expiry
   */
  private Refresh refreshUnderLock(Credential observed, Duration threshold) {
    CredentialKey key = observed.key();
    return locks.withLock(key, () -> {
      Credential current = requireUsable(key.ownerId(), key.provider());
      Instant now = clock.instant();
      if (threshold != null && current.isValidFor(now, threshold)) {
        return new Refresh(current, false);
      }
      // A status change alone does not count; only new tokens that are still usable do.
      if (tokensChanged(observed, current) && current.isValidFor(now, safetyMargin)) {
        logger.log(Level.FINE, "Credential {0} was refreshed concurrently", key);
        return new Refresh(current, false);
      }
      return new Refresh(doRefresh(current), true);
    });
  }

  private static boolean tokensChanged(Credential observed, Credential current) {
    return !current.accessToken().equals(observed.accessToken())
        || !current.expiresAt().equals(observed.expiresAt());
  }

  private Credential doRefresh(Credential current) {
    String ownerId = current.ownerId();
    String provider = current.provider();
    ProviderRefresher refresher = refreshers.get(provider);
    if (refresher == null) {
      throw new IllegalStateException("No ProviderRefresher registered for provider: " + provider
          + ". Registered: " + refreshers.keySet());
    }
    if (current.refreshToken() == null || current.refreshToken().isEmpty()) {
      revoke(current.key(), "no refresh token stored");
      throw AuthException.reauthorizationRequired(ownerId, provider,
          "Credential for " + current.key() + " has no refresh token");
    }

    TokenGrant grant;
    try {
      grant = refresher.refresh(current.refreshToken());
    } catch (ProviderRefreshException e) {
      if (e.reason() == ProviderRefreshException.Reason.INVALID_GRANT) {
        revoke(current.key(), e.getMessage());
        throw new AuthException(ownerId, provider, true,
            "Refresh token for " + current.key() + " was rejected: " + e.getMessage(), e);
      }
      metrics.incrementCredentialRefreshFailures();
      throw new AuthException(ownerId, provider, false,
          "Refresh of " + current.key() + " failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      metrics.incrementCredentialRefreshFailures();
      throw new AuthException(ownerId, provider, false,
          "Refresh of " + current.key() + " failed: " + e, e);
    }

    Instant refreshedAt = clock.instant();
    Duration lifetime = grant.expiresIn() != null ? grant.expiresIn() : ProviderDefaults.lifetime(provider);
    String refreshToken = grant.refreshToken() != null ? grant.refreshToken() : current.refreshToken();
    Set<String> scope = grant.scope() != null ? grant.scope() : current.scope();
    Credential refreshed = current.withTokens(grant.accessToken(), refreshToken,
        refreshedAt.plus(lifetime), scope, refreshedAt);

    int updated = withConnection("store refreshed credential", conn -> credentialStore.update(conn, refreshed));
    if (updated == 0) {
      throw AuthException.reauthorizationRequired(ownerId, provider,
          "Credential for " + current.key() + " disappeared during refresh");
    }
    metrics.incrementCredentialsRefreshed();
    logger.log(Level.FINE, "Refreshed credential {0}, expires at {1}",
        new Object[]{current.key(), refreshed.expiresAt()});
    return refreshed;
  }

  private void revoke(CredentialKey key, String reason) {
    withConnection("revoke credential", conn -> credentialStore.markStatus(conn,
        key.ownerId(), key.provider(), CredentialStatus.REVOKED, clock.instant()));
    metrics.incrementCredentialsRevoked();
    logger.log(Level.WARNING, "Credential {0} revoked ({1}); reauthorization required",
        new Object[]{key, reason});
  }

  private void markExpiring(CredentialKey key) {
    try {
      withConnection("mark credential expiring", conn -> credentialStore.markStatus(conn,
          key.ownerId(), key.provider(), CredentialStatus.EXPIRING, clock.instant()));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to mark " + key + " as expiring", e);
    }
  }

  private <T> T withConnection(String action, SqlFunction<T> fn) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return fn.apply(conn);
    } catch (SQLException e) {
      throw new TasklineException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  private record Refresh(Credential credential, boolean providerCalled) {
  }

  /** Shuts down the sweep pool. */
  @Override
  public void close() {
    sweepPool.shutdownNow();
    try {
      sweepPool.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link TokenRefreshManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CredentialStore credentialStore;
    private final Map<String, ProviderRefresher> refreshers = new HashMap<>();
    private Clock clock;
    private Duration safetyMargin = Duration.ofMinutes(5);
    private Duration expiringSoonWindow = Duration.ofHours(24);
    private int sweepConcurrency = 10;
    private MetricsExporter metrics;

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
    public Builder credentialStore(CredentialStore credentialStore) {
      this.credentialStore = credentialStore;
      return this;
    }

    /**
     * Registers the refresh call for one provider.
     *
     * @throws IllegalStateException if the provider already has a refresher
     */
    public Builder refresher(String provider, ProviderRefresher refresher) {
      Objects.requireNonNull(provider, "provider");
      Objects.requireNonNull(refresher, "refresher");
      if (refreshers.putIfAbsent(provider, refresher) != null) {
        throw new IllegalStateException("ProviderRefresher already registered for provider: " + provider);
      }
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
     * Sets how long a token must stay valid for {@link #getValidToken} to return it
     * without refreshing.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder safetyMargin(Duration safetyMargin) {
      this.safetyMargin = Objects.requireNonNull(safetyMargin, "safetyMargin");
      return this;
    }

    /**
     * Sets the window reported as {@link TokenStatus#expiringSoon()}.
     *
     * <p>Optional. Defaults to 24 hours.
     */
    public Builder expiringSoonWindow(Duration expiringSoonWindow) {
      this.expiringSoonWindow = Objects.requireNonNull(expiringSoonWindow, "expiringSoonWindow");
      return this;
    }

    /**
     * Sets the number of credentials refreshed in parallel by a sweep.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder sweepConcurrency(int sweepConcurrency) {
      this.sweepConcurrency = sweepConcurrency;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public TokenRefreshManager build() {
      return new TokenRefreshManager(this);
    }
  }
}
