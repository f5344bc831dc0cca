package io.taskline.jdbc.store;

import io.taskline.ErrorKind;
import io.taskline.JobRequest;
import io.taskline.StandardJobType;
import io.taskline.jdbc.Schemas;
import io.taskline.model.Job;
import io.taskline.model.JobError;
import io.taskline.model.JobQuery;
import io.taskline.model.JobStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class H2JobStoreTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private JdbcDataSource dataSource;
  private final H2JobStore store = new H2JobStore();

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = Schemas.h2DataSource();
  }

  // ── Insert and read ─────────────────────────────────────────────

  @Test
  void insertAndFindById() throws SQLException {
    Job job = JobRequest.builder(StandardJobType.SCHEDULED_POST)
        .jobId("job-1")
        .ownerId("user-1")
        .payload("{\"text\":\"hello\"}")
        .scheduledTime(NOW.plusSeconds(60))
        .maxAttempts(4)
        .build()
        .toJob(NOW);

    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, job);

      assertEquals(job, store.findById(conn, "job-1").orElseThrow());
      assertTrue(store.findById(conn, "missing").isEmpty());
    }
  }

  // ── Claim ───────────────────────────────────────────────────────

  @Test
  void claimTakesDueJobsOldestFirstAndCountsAttempt() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "late", NOW.minusSeconds(10));
      insert(conn, "early", NOW.minusSeconds(60));
      insert(conn, "future", NOW.plusSeconds(60));

      List<Job> claimed = store.claimDue(conn, "worker-a", NOW, 10);

      assertEquals(List.of("early", "late"), claimed.stream().map(Job::jobId).toList());
      for (Job job : claimed) {
        assertEquals(JobStatus.PROCESSING, job.status());
        assertEquals(1, job.attempts());
      }
      assertEquals(JobStatus.PENDING, store.findById(conn, "future").orElseThrow().status());
      assertTrue(store.claimDue(conn, "worker-a", NOW, 10).isEmpty());
    }
  }

  @Test
  void claimRespectsLimit() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      for (int i = 0; i < 5; i++) {
        insert(conn, "job-" + i, NOW.minusSeconds(100 - i));
      }

      List<Job> first = store.claimDue(conn, "worker-a", NOW, 2);
      List<Job> second = store.claimDue(conn, "worker-a", NOW, 2);

      assertEquals(List.of("job-0", "job-1"), first.stream().map(Job::jobId).toList());
      assertEquals(List.of("job-2", "job-3"), second.stream().map(Job::jobId).toList());
    }
  }

  @Test
  void concurrentClaimsNeverReturnTheSameJob() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      for (int i = 0; i < 200; i++) {
        insert(conn, String.format("job-%03d", i), NOW.minusSeconds(300 - i));
      }
    }

    int workers = 4;
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<List<String>>> futures = new ArrayList<>();
      for (int w = 0; w < workers; w++) {
        String workerId = "worker-" + w;
        Callable<List<String>> task = () -> {
          start.await();
          List<String> mine = new ArrayList<>();
          while (true) {
            List<Job> batch;
            try (Connection conn = dataSource.getConnection()) {
              conn.setAutoCommit(false);
              batch = store.claimDue(conn, workerId, NOW, 7);
              conn.commit();
            }
            if (batch.isEmpty()) {
              return mine;
            }
            batch.forEach(job -> mine.add(job.jobId()));
          }
        };
        futures.add(pool.submit(task));
      }
      start.countDown();

      List<String> all = new ArrayList<>();
      for (Future<List<String>> future : futures) {
        all.addAll(future.get(30, TimeUnit.SECONDS));
      }
      Set<String> unique = new HashSet<>(all);
      assertEquals(all.size(), unique.size(), "a job was claimed twice");
      assertEquals(200, unique.size());
    } finally {
      pool.shutdownNow();
    }
  }

  // ── Transitions ─────────────────────────────────────────────────

  @Test
  void completeStoresResult() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "job-1", NOW);
      store.claimDue(conn, "w", NOW, 10);

      assertEquals(1, store.complete(conn, "job-1", "{\"ok\":true}", NOW.plusSeconds(2)));
      assertEquals(0, store.complete(conn, "job-1", "again", NOW.plusSeconds(3)));

      Job job = store.findById(conn, "job-1").orElseThrow();
      assertEquals(JobStatus.COMPLETED, job.status());
      assertEquals("{\"ok\":true}", job.result());
      assertEquals(NOW.plusSeconds(2), job.executedAt());
    }
  }

  @Test
  void retryableFailureReschedulesWhileAttemptsRemain() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "job-1", NOW, 2);
      store.claimDue(conn, "w", NOW, 10);
      JobError error = new JobError(ErrorKind.TRANSIENT, "timeout", NOW);

      assertEquals(1, store.fail(conn, "job-1", error, NOW.plusSeconds(30)));
      Job retried = store.findById(conn, "job-1").orElseThrow();
      assertEquals(JobStatus.PENDING, retried.status());
      assertEquals(NOW.plusSeconds(30), retried.scheduledTime());
      assertEquals(error, retried.lastError());

      store.claimDue(conn, "w", NOW.plusSeconds(30), 10);
      store.fail(conn, "job-1", error, NOW.plusSeconds(90));
      Job exhausted = store.findById(conn, "job-1").orElseThrow();
      assertEquals(JobStatus.FAILED, exhausted.status());
      assertEquals(2, exhausted.attempts());
      assertEquals(NOW.plusSeconds(30), exhausted.scheduledTime());
    }
  }

  @Test
  void terminalFailureSetsAttemptsToMax() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "job-1", NOW, 5);
      store.claimDue(conn, "w", NOW, 10);

      store.fail(conn, "job-1", new JobError(ErrorKind.AUTH, "token revoked", NOW), null);

      Job job = store.findById(conn, "job-1").orElseThrow();
      assertEquals(JobStatus.FAILED, job.status());
      assertEquals(5, job.attempts());
      assertTrue(job.lastError().reauthorizationRequired());
    }
  }

  @Test
  void longErrorMessagesAreTruncated() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "job-1", NOW);
      store.claimDue(conn, "w", NOW, 10);

      store.fail(conn, "job-1", new JobError(ErrorKind.PERMANENT, "x".repeat(5000), NOW), null);

      String message = store.findById(conn, "job-1").orElseThrow().lastError().message();
      assertEquals(4000, message.length());
      assertTrue(message.endsWith("..."));
    }
  }

  @Test
  void cancelOnlyAffectsPendingJobs() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "pending", NOW.plusSeconds(60));
      insert(conn, "running", NOW);
      store.claimDue(conn, "w", NOW, 10);

      assertEquals(1, store.cancel(conn, "pending", NOW));
      assertEquals(0, store.cancel(conn, "running", NOW));
      assertEquals(0, store.cancel(conn, "pending", NOW));

      Job cancelled = store.findById(conn, "pending").orElseThrow();
      assertEquals(JobStatus.CANCELLED, cancelled.status());
      assertEquals(NOW, cancelled.cancelledAt());
    }
  }

  @Test
  void releaseStaleRequeuesOrFailsAbandonedClaims() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "retry", NOW, 3);
      insert(conn, "last", NOW, 1);
      store.claimDue(conn, "crashed", NOW, 10);
      insert(conn, "fresh", NOW.plusSeconds(3600));
      store.claimDue(conn, "alive", NOW.plusSeconds(3600), 10);

      int released = store.releaseStale(conn, NOW.plusSeconds(1800),
          new JobError(ErrorKind.TRANSIENT, "claim expired", NOW.plusSeconds(3600)));

      assertEquals(2, released);
      assertEquals(JobStatus.PENDING, store.findById(conn, "retry").orElseThrow().status());
      assertEquals(JobStatus.FAILED, store.findById(conn, "last").orElseThrow().status());
      assertEquals(JobStatus.PROCESSING, store.findById(conn, "fresh").orElseThrow().status());
    }
  }

  @Test
  void releaseStaleStampsExecutionTimeOnlyOnTerminalFailure() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "retry", NOW, 3);
      insert(conn, "last", NOW, 1);
      store.claimDue(conn, "crashed", NOW, 10);

      store.releaseStale(conn, NOW.plusSeconds(1800),
          new JobError(ErrorKind.TRANSIENT, "claim expired", NOW.plusSeconds(3600)));

      Job failed = store.findById(conn, "last").orElseThrow();
      assertEquals(JobStatus.FAILED, failed.status());
      assertEquals(NOW.plusSeconds(3600), failed.executedAt());
      Job requeued = store.findById(conn, "retry").orElseThrow();
      assertEquals(JobStatus.PENDING, requeued.status());
      assertNull(requeued.executedAt());
      assertEquals(NOW.plusSeconds(3600), requeued.lastError().occurredAt());
    }
  }

  // ── Queries ─────────────────────────────────────────────────────

  @Test
  void queryFiltersAndOrdersNewestFirst() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, JobRequest.builder(StandardJobType.SCHEDULED_POST).jobId("a").ownerId("u1")
          .scheduledTime(NOW.plusSeconds(10)).build().toJob(NOW));
      store.insert(conn, JobRequest.builder(StandardJobType.SCHEDULED_POST).jobId("b").ownerId("u1")
          .scheduledTime(NOW.plusSeconds(20)).build().toJob(NOW));
      store.insert(conn, JobRequest.builder(StandardJobType.EMAIL_CAMPAIGN).jobId("c").ownerId("u1")
          .scheduledTime(NOW.plusSeconds(30)).build().toJob(NOW));
      store.insert(conn, JobRequest.builder(StandardJobType.SCHEDULED_POST).jobId("d").ownerId("u2")
          .scheduledTime(NOW.plusSeconds(40)).build().toJob(NOW));

      List<Job> posts = store.query(conn, JobQuery.forOwner("u1").withJobType(StandardJobType.SCHEDULED_POST));
      assertEquals(List.of("b", "a"), posts.stream().map(Job::jobId).toList());

      assertEquals(1, store.query(conn, JobQuery.all().withLimit(1)).size());
      assertTrue(store.query(conn, JobQuery.all().withStatus(JobStatus.FAILED)).isEmpty());
    }
  }

  @Test
  void countByStatus() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      insert(conn, "a", NOW);
      insert(conn, "b", NOW.plusSeconds(60));
      insert(conn, "c", NOW.plusSeconds(60));
      store.claimDue(conn, "w", NOW, 10);

      Map<JobStatus, Long> counts = store.countByStatus(conn);

      assertEquals(2L, counts.get(JobStatus.PENDING));
      assertEquals(1L, counts.get(JobStatus.PROCESSING));
      assertNull(counts.get(JobStatus.FAILED));
    }
  }

  private void insert(Connection conn, String jobId, Instant scheduledTime) {
    insert(conn, jobId, scheduledTime, JobRequest.DEFAULT_MAX_ATTEMPTS);
  }

  private void insert(Connection conn, String jobId, Instant scheduledTime, int maxAttempts) {
    store.insert(conn, JobRequest.builder(StandardJobType.ANALYTICS_SYNC)
        .jobId(jobId)
        .scheduledTime(scheduledTime)
        .maxAttempts(maxAttempts)
        .build()
        .toJob(NOW.minusSeconds(600)));
  }
}
