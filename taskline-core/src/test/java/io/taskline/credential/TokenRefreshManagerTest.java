package io.taskline.credential;

import io.taskline.AuthException;
import io.taskline.model.Credential;
import io.taskline.model.CredentialKey;
import io.taskline.model.CredentialStatus;
import io.taskline.testing.MutableClock;
import io.taskline.testing.StubCredentialStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.taskline.testing.Stubs.awaitTrue;
import static io.taskline.testing.Stubs.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenRefreshManagerTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final StubCredentialStore store = new StubCredentialStore();
  private final AtomicInteger providerCalls = new AtomicInteger();
  private TokenRefreshManager manager;

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.close();
    }
  }

  @Test
  void returnsStoredTokenWhileOutsideSafetyMargin() {
    store.upsert(null, credential("user-1", "linkedin", "at-old", "rt-1", NOW.plus(Duration.ofHours(2))));
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at-new", Duration.ofHours(1)));

    assertEquals("at-old", manager.getValidToken("user-1", "linkedin"));
    assertEquals(0, providerCalls.get());
  }

  @Test
  void refreshesTokenExpiringWithinMargin() {
    store.upsert(null, credential("user-1", "linkedin", "at-old", "rt-1", NOW.plus(Duration.ofMinutes(30))));
    manager = newManager(Duration.ofHours(24), "linkedin", countingRefresher("at-new", Duration.ofHours(2)));

    String token = manager.getValidToken("user-1", "linkedin");

    assertEquals("at-new", token);
    assertEquals(1, providerCalls.get());
    Credential stored = store.get("user-1", "linkedin");
    assertEquals("at-new", stored.accessToken());
    assertEquals(NOW.plus(Duration.ofHours(2)), stored.expiresAt());
    assertEquals("rt-1", stored.refreshToken());
    assertEquals(CredentialStatus.ACTIVE, stored.status());
  }

  @Test
  void rotatedRefreshTokenIsStored() {
    store.upsert(null, credential("user-1", "twitter", "at-old", "rt-1", NOW.minusSeconds(1)));
    manager = newManager(Duration.ofMinutes(5), "twitter",
        rt -> new TokenGrant("at-new", "rt-2", Duration.ofHours(2), Set.of("tweet.write")));

    manager.getValidToken("user-1", "twitter");

    Credential stored = store.get("user-1", "twitter");
    assertEquals("rt-2", stored.refreshToken());
    assertEquals(Set.of("tweet.write"), stored.scope());
  }

  @Test
  void missingExpiresInUsesProviderDefault() {
    store.upsert(null, credential("user-1", "linkedin", "at-old", "rt-1", NOW.minusSeconds(1)));
    manager = newManager(Duration.ofMinutes(5), "linkedin", rt -> TokenGrant.of("at-new", null));

    manager.getValidToken("user-1", "linkedin");

    assertEquals(NOW.plus(Duration.ofDays(60)), store.get("user-1", "linkedin").expiresAt());
  }

  @Test
  void missingCredentialRequiresReauthorization() {
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at", Duration.ofHours(1)));

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "linkedin"));

    assertTrue(e.reauthorizationRequired());
    assertEquals("user-1", e.ownerId());
    assertEquals("linkedin", e.provider());
  }

  @Test
  void revokedCredentialRequiresReauthorizationWithoutProviderCall() {
    store.upsert(null, credential("user-1", "linkedin", "at", "rt", NOW.plus(Duration.ofDays(1)))
        .withStatus(CredentialStatus.REVOKED, NOW));
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at", Duration.ofHours(1)));

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "linkedin"));

    assertTrue(e.reauthorizationRequired());
    assertEquals(0, providerCalls.get());
  }

  @Test
  void rejectedRefreshTokenRevokesCredential() {
    store.upsert(null, credential("user-1", "facebook", "at", "rt", NOW.minusSeconds(1)));
    manager = newManager(Duration.ofMinutes(5), "facebook", rt -> {
      throw ProviderRefreshException.invalidGrant("invalid_grant: token revoked by user");
    });

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "facebook"));

    assertTrue(e.reauthorizationRequired());
    assertEquals(CredentialStatus.REVOKED, store.get("user-1", "facebook").status());
  }

  @Test
  void transientProviderFailureKeepsCredentialUsable() {
    Credential original = credential("user-1", "zoho", "at", "rt", NOW.plusSeconds(60));
    store.upsert(null, original);
    manager = newManager(Duration.ofMinutes(5), "zoho", rt -> {
      throw ProviderRefreshException.transientFailure("503 from token endpoint", null);
    });

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "zoho"));

    assertFalse(e.reauthorizationRequired());
    assertEquals(original, store.get("user-1", "zoho"));
  }

  @Test
  void credentialWithoutRefreshTokenIsRevoked() {
    store.upsert(null, credential("user-1", "instagram", "at", null, NOW.minusSeconds(1)));
    manager = newManager(Duration.ofMinutes(5), "instagram", countingRefresher("at", Duration.ofHours(1)));

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "instagram"));

    assertTrue(e.reauthorizationRequired());
    assertEquals(CredentialStatus.REVOKED, store.get("user-1", "instagram").status());
    assertEquals(0, providerCalls.get());
  }

  @Test
  void unknownProviderIsAConfigurationError() {
    store.upsert(null, credential("user-1", "myspace", "at", "rt", NOW.minusSeconds(1)));
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at", Duration.ofHours(1)));

    assertThrows(IllegalStateException.class, () -> manager.getValidToken("user-1", "myspace"));
  }

  @Test
  void forcedRefreshCallsProviderEvenWhenValid() {
    store.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.plus(Duration.ofDays(30))));
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at-new", Duration.ofDays(60)));

    Credential refreshed = manager.refresh("user-1", "linkedin");

    assertEquals("at-new", refreshed.accessToken());
    assertEquals(1, providerCalls.get());
  }

  @Test
  void concurrentSweepsCallProviderOnceAndSeeSameExpiry() throws Exception {
    CountDownLatch bothListed = new CountDownLatch(2);
    StubCredentialStore listingStore = new StubCredentialStore() {
      @Override
      public List<Credential> listExpiring(Connection conn, Instant cutoff) {
        List<Credential> expiring = super.listExpiring(conn, cutoff);
        bothListed.countDown();
        return expiring;
      }
    };
    listingStore.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.plus(Duration.ofMinutes(30))));
    manager = TokenRefreshManager.builder()
        .connectionProvider(stubCp())
        .credentialStore(listingStore)
        .clock(clock)
        .refresher("linkedin", rt -> {
          providerCalls.incrementAndGet();
          try {
            bothListed.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return TokenGrant.of("at-new", Duration.ofDays(60));
        })
        .build();

    ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      Future<SweepReport> first = callers.submit(() -> manager.sweepExpiring(Duration.ofHours(24)));
      Future<SweepReport> second = callers.submit(() -> manager.sweepExpiring(Duration.ofHours(24)));
      SweepReport a = first.get(10, TimeUnit.SECONDS);
      SweepReport b = second.get(10, TimeUnit.SECONDS);

      assertEquals(1, providerCalls.get());
      assertEquals(1, a.total());
      assertEquals(1, b.total());
      assertEquals(a.outcomes().get(0).expiresAt(), b.outcomes().get(0).expiresAt());
      assertEquals(1, a.count(RefreshOutcome.Status.REFRESHED) + b.count(RefreshOutcome.Status.REFRESHED));
      assertEquals(1, a.count(RefreshOutcome.Status.ALREADY_FRESH) + b.count(RefreshOutcome.Status.ALREADY_FRESH));
    } finally {
      callers.shutdownNow();
    }
  }

  @Test
  void sweepCollectsPerCredentialOutcomes() {
    store.upsert(null, credential("ok", "linkedin", "at", "rt-ok", NOW.plus(Duration.ofHours(1))));
    store.upsert(null, credential("bad", "linkedin", "at", "rt-bad", NOW.plus(Duration.ofHours(2))));
    store.upsert(null, credential("down", "linkedin", "at", "rt-down", NOW.minus(Duration.ofHours(1))));
    store.upsert(null, credential("later", "linkedin", "at", "rt-later", NOW.plus(Duration.ofDays(10))));
    manager = newManager(Duration.ofMinutes(5), "linkedin", rt -> {
      switch (rt) {
        case "rt-bad":
          throw ProviderRefreshException.invalidGrant("invalid_grant");
        case "rt-down":
          throw ProviderRefreshException.transientFailure("timeout", null);
        default:
          return TokenGrant.of("at-new", Duration.ofDays(60));
      }
    });

    SweepReport report = manager.sweepExpiring(Duration.ofHours(24));

    assertEquals(3, report.total());
    assertEquals("down", report.outcomes().get(0).key().ownerId());
    assertEquals(1, report.count(RefreshOutcome.Status.REFRESHED));
    assertEquals(1, report.count(RefreshOutcome.Status.REVOKED));
    assertEquals(1, report.count(RefreshOutcome.Status.FAILED));
    assertEquals(CredentialStatus.REVOKED, store.get("bad", "linkedin").status());
    assertEquals(CredentialStatus.EXPIRING, store.get("down", "linkedin").status());
    assertEquals(CredentialStatus.ACTIVE, store.get("ok", "linkedin").status());
    assertEquals("{\"total\":3,\"refreshed\":1,\"skipped\":0,\"failed\":1,\"revoked\":1}", report.toJson());
  }

  // ── Status changes between the first read and the locked re-read ───

  @Test
  void expiredTokenMarkedExpiringMeanwhileIsStillRefreshed() {
    StubCredentialStore racingStore = markAfterFirstRead(CredentialStatus.EXPIRING);
    racingStore.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.minus(Duration.ofMinutes(1))));
    manager = newManager(racingStore, "linkedin", countingRefresher("at-new", Duration.ofDays(60)));

    String token = manager.getValidToken("user-1", "linkedin");

    assertEquals("at-new", token);
    assertEquals(1, providerCalls.get());
    Credential stored = racingStore.get("user-1", "linkedin");
    assertEquals(CredentialStatus.ACTIVE, stored.status());
    assertEquals(NOW.plus(Duration.ofDays(60)), stored.expiresAt());
  }

  @Test
  void forcedRefreshIgnoresStatusOnlyChange() {
    StubCredentialStore racingStore = markAfterFirstRead(CredentialStatus.EXPIRING);
    racingStore.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.plus(Duration.ofDays(30))));
    manager = newManager(racingStore, "linkedin", countingRefresher("at-new", Duration.ofDays(60)));

    Credential refreshed = manager.refresh("user-1", "linkedin");

    assertEquals("at-new", refreshed.accessToken());
    assertEquals(1, providerCalls.get());
  }

  @Test
  void credentialRevokedMeanwhileRequiresReauthorizationWithoutProviderCall() {
    StubCredentialStore racingStore = markAfterFirstRead(CredentialStatus.REVOKED);
    racingStore.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.minus(Duration.ofMinutes(1))));
    manager = newManager(racingStore, "linkedin", countingRefresher("at-new", Duration.ofDays(60)));

    AuthException e = assertThrows(AuthException.class, () -> manager.getValidToken("user-1", "linkedin"));

    assertTrue(e.reauthorizationRequired());
    assertEquals(0, providerCalls.get());
  }

  @Test
  void expiredTokenInSweepIsRefreshedAfterStatusOnlyChange() {
    StubCredentialStore racingStore = new StubCredentialStore() {
      @Override
      public List<Credential> listExpiring(Connection conn, Instant cutoff) {
        List<Credential> expiring = super.listExpiring(conn, cutoff);
        markStatus(conn, "user-1", "linkedin", CredentialStatus.EXPIRING, NOW);
        return expiring;
      }
    };
    racingStore.upsert(null, credential("user-1", "linkedin", "at-old", "rt", NOW.minus(Duration.ofMinutes(1))));
    manager = newManager(racingStore, "linkedin", countingRefresher("at-new", Duration.ofDays(60)));

    SweepReport report = manager.sweepExpiring(Duration.ofHours(24));

    assertEquals(1, report.count(RefreshOutcome.Status.REFRESHED));
    assertEquals(0, report.count(RefreshOutcome.Status.ALREADY_FRESH));
    assertEquals(1, providerCalls.get());
    assertEquals("at-new", racingStore.get("user-1", "linkedin").accessToken());
  }

  // ── Callers waiting on the lock while another caller's refresh fails ───

  @Test
  void waitingCallerRefreshesAfterTransientFailure() throws Exception {
    store.upsert(null, credential("user-1", "zoho", "at-old", "rt", NOW.minus(Duration.ofMinutes(1))));
    CountDownLatch firstCallEntered = new CountDownLatch(1);
    CountDownLatch failFirstCall = new CountDownLatch(1);
    manager = newManager(Duration.ofMinutes(5), "zoho", rt -> {
      if (providerCalls.incrementAndGet() == 1) {
        firstCallEntered.countDown();
        try {
          failFirstCall.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        throw ProviderRefreshException.transientFailure("503 from token endpoint", null);
      }
      return TokenGrant.of("at-new", Duration.ofHours(1));
    });

    ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      Future<String> first = callers.submit(() -> manager.getValidToken("user-1", "zoho"));
      assertTrue(firstCallEntered.await(5, TimeUnit.SECONDS));
      Future<String> second = callers.submit(() -> manager.getValidToken("user-1", "zoho"));
      awaitTrue(() -> manager.locks.hasWaiters(new CredentialKey("user-1", "zoho")),
          Duration.ofSeconds(5), "second caller waiting on the credential lock");
      failFirstCall.countDown();

      ExecutionException failure = assertThrows(ExecutionException.class,
          () -> first.get(10, TimeUnit.SECONDS));
      AuthException cause = assertInstanceOf(AuthException.class, failure.getCause());
      assertFalse(cause.reauthorizationRequired());
      assertEquals("at-new", second.get(10, TimeUnit.SECONDS));
      assertEquals(2, providerCalls.get());
      assertEquals("at-new", store.get("user-1", "zoho").accessToken());
    } finally {
      callers.shutdownNow();
    }
  }

  @Test
  void waitingCallerSeesRevocationAfterRejectedRefreshToken() throws Exception {
    store.upsert(null, credential("user-1", "zoho", "at-old", "rt", NOW.minus(Duration.ofMinutes(1))));
    CountDownLatch firstCallEntered = new CountDownLatch(1);
    CountDownLatch rejectFirstCall = new CountDownLatch(1);
    manager = newManager(Duration.ofMinutes(5), "zoho", rt -> {
      providerCalls.incrementAndGet();
      firstCallEntered.countDown();
      try {
        rejectFirstCall.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      throw ProviderRefreshException.invalidGrant("invalid_grant");
    });

    ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      Future<String> first = callers.submit(() -> manager.getValidToken("user-1", "zoho"));
      assertTrue(firstCallEntered.await(5, TimeUnit.SECONDS));
      Future<String> second = callers.submit(() -> manager.getValidToken("user-1", "zoho"));
      awaitTrue(() -> manager.locks.hasWaiters(new CredentialKey("user-1", "zoho")),
          Duration.ofSeconds(5), "second caller waiting on the credential lock");
      rejectFirstCall.countDown();

      for (Future<String> caller : List.of(first, second)) {
        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> caller.get(10, TimeUnit.SECONDS));
        AuthException cause = assertInstanceOf(AuthException.class, failure.getCause());
        assertTrue(cause.reauthorizationRequired());
      }
      assertEquals(1, providerCalls.get());
      assertEquals(CredentialStatus.REVOKED, store.get("user-1", "zoho").status());
    } finally {
      callers.shutdownNow();
    }
  }

  @Test
  void tokenStatusFlagsExpiredAndExpiringSoon() {
    store.upsert(null, credential("user-1", "facebook", "at", "rt", NOW.plus(Duration.ofDays(30))));
    store.upsert(null, credential("user-1", "linkedin", "at", "rt", NOW.plus(Duration.ofHours(3))));
    store.upsert(null, credential("user-1", "zoho", "at", "rt", NOW.minusSeconds(10)));
    manager = newManager(Duration.ofMinutes(5), "linkedin", countingRefresher("at", Duration.ofHours(1)));

    List<TokenStatus> statuses = manager.tokenStatus("user-1");

    assertEquals(3, statuses.size());
    TokenStatus facebook = statuses.get(0);
    assertFalse(facebook.expired());
    assertFalse(facebook.expiringSoon());
    TokenStatus linkedin = statuses.get(1);
    assertFalse(linkedin.expired());
    assertTrue(linkedin.expiringSoon());
    TokenStatus zoho = statuses.get(2);
    assertTrue(zoho.expired());
    assertNotNull(zoho.expiresAt());
  }

  private TokenRefreshManager newManager(StubCredentialStore credentialStore, String provider,
      ProviderRefresher refresher) {
    return TokenRefreshManager.builder()
        .connectionProvider(stubCp())
        .credentialStore(credentialStore)
        .clock(clock)
        .safetyMargin(Duration.ofMinutes(5))
        .refresher(provider, refresher)
        .build();
  }

  /**
   * Store that sets the given status once, right after the first read.
   */
  private static StubCredentialStore markAfterFirstRead(CredentialStatus status) {
    AtomicBoolean marked = new AtomicBoolean();
    return new StubCredentialStore() {
      @Override
      public Optional<Credential> get(Connection conn, String ownerId, String provider) {
        Optional<Credential> read = super.get(conn, ownerId, provider);
        if (marked.compareAndSet(false, true)) {
          markStatus(conn, ownerId, provider, status, NOW);
        }
        return read;
      }
    };
  }

  private TokenRefreshManager newManager(Duration margin, String provider, ProviderRefresher refresher) {
    return TokenRefreshManager.builder()
        .connectionProvider(stubCp())
        .credentialStore(store)
        .clock(clock)
        .safetyMargin(margin)
        .refresher(provider, refresher)
        .build();
  }

  private ProviderRefresher countingRefresher(String accessToken, Duration expiresIn) {
    return rt -> {
      providerCalls.incrementAndGet();
      return TokenGrant.of(accessToken, expiresIn);
    };
  }

  private static Credential credential(String owner, String provider, String accessToken,
      String refreshToken, Instant expiresAt) {
    return new Credential(owner, provider, accessToken, refreshToken, expiresAt,
        Set.of("w_member_social"), CredentialStatus.ACTIVE, NOW.minus(Duration.ofDays(1)));
  }
}
