package io.taskline.jdbc.store;

import io.taskline.ErrorKind;
import io.taskline.jdbc.JdbcTemplate;
import io.taskline.jdbc.TableNames;
import io.taskline.model.Job;
import io.taskline.model.JobError;
import io.taskline.model.JobQuery;
import io.taskline.model.JobStatus;
import io.taskline.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/io.taskline.jdbc.store.AbstractJdbcJobStore}.
 *
 * <p>The default claim is two-phase: an {@code UPDATE} over a subquery that stamps the
 * claimed rows with a fresh claim token, then a {@code SELECT} by that token. The outer
 * {@code status} predicate makes a row already taken by a concurrent claim drop out of
 * the update.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final int PENDING = JobStatus.PENDING.code();
  protected static final int PROCESSING = JobStatus.PROCESSING.code();
  protected static final int FAILED = JobStatus.FAILED.code();

  protected static final String COLUMNS = "job_id, job_type, owner_id, payload, scheduled_time, status, " +
      "attempts, max_attempts, error_kind, last_error, error_at, result, created_at, executed_at, cancelled_at";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> {
    String errorKind = rs.getString("error_kind");
    JobError lastError = errorKind == null ? null : new JobError(
        ErrorKind.valueOf(errorKind),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "error_at"));
    return new Job(
        rs.getString("job_id"),
        rs.getString("job_type"),
        rs.getString("owner_id"),
        rs.getString("payload"),
        JdbcTemplate.instant(rs, "scheduled_time"),
        JobStatus.fromCode(rs.getInt("status")),
        rs.getInt("attempts"),
        rs.getInt("max_attempts"),
        lastError,
        rs.getString("result"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "executed_at"),
        JdbcTemplate.instant(rs, "cancelled_at"));
  };

  private final String tableName;

  protected AbstractJdbcJobStore() {
    this(TableNames.JOB_TABLE);
  }

  protected AbstractJdbcJobStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  @Override
  public void insert(Connection conn, Job job) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JobError error = job.lastError();
    JdbcTemplate.update(conn, sql,
        job.jobId(), job.jobType(), job.ownerId(), job.payload(), job.scheduledTime(),
        job.status().code(), job.attempts(), job.maxAttempts(),
        error == null ? null : error.kind().name(),
        error == null ? null : truncateError(error.message()),
        error == null ? null : error.occurredAt(),
        job.result(), job.createdAt(), job.executedAt(), job.cancelledAt());
  }

  @Override
  public List<Job> claimDue(Connection conn, String workerId, Instant now, int limit) {
    Objects.requireNonNull(workerId, "workerId");
    String token = newClaimToken();
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + tableName() +
        " SET status=" + PROCESSING + ", attempts=attempts+1, claimed_by=?, claimed_at=?, claim_token=?" +
        " WHERE status=" + PENDING + " AND job_id IN (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status=" + PENDING + " AND scheduled_time <= ?" +
        " ORDER BY scheduled_time LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, workerId, now, token, now, limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed in this cycle
    return selectClaimed(conn, token);
  }

  /**
   * Selects the rows stamped with the given claim token, oldest scheduled time first.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<Job> selectClaimed(Connection conn, String claimToken) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE claim_token=? AND status=" + PROCESSING + " ORDER BY scheduled_time";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, claimToken);
  }

  protected static String newClaimToken() {
    return UUID.randomUUID().toString();
  }

  protected static List<Job> sortByScheduledTime(List<Job> jobs) {
    List<Job> sorted = new ArrayList<>(jobs);
    sorted.sort(Comparator.comparing(Job::scheduledTime));
    return sorted;
  }

  @Override
  public int complete(Connection conn, String jobId, String result, Instant executedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.COMPLETED.code() + ", result=?, executed_at=?," +
        " claimed_by=NULL, claimed_at=NULL, claim_token=NULL" +
        " WHERE job_id=? AND status=" + PROCESSING;
    return JdbcTemplate.update(conn, sql, result, executedAt, jobId);
  }

  @Override
  public int fail(Connection conn, String jobId, JobError error, Instant retryAt) {
    Objects.requireNonNull(error, "error");
    String message = truncateError(error.message());
    if (retryAt != null && error.kind().isRetryable()) {
      // scheduled_time first: MySQL evaluates assignments left to right
      String sql = "UPDATE " + tableName() +
          " SET scheduled_time = CASE WHEN attempts < max_attempts THEN ? ELSE scheduled_time END," +
          " status = CASE WHEN attempts < max_attempts THEN " + PENDING + " ELSE " + FAILED + " END," +
          " error_kind=?, last_error=?, error_at=?, executed_at=?," +
          " claimed_by=NULL, claimed_at=NULL, claim_token=NULL" +
          " WHERE job_id=? AND status=" + PROCESSING;
      return JdbcTemplate.update(conn, sql, retryAt, error.kind().name(), message,
          error.occurredAt(), error.occurredAt(), jobId);
    }
    String sql = "UPDATE " + tableName() +
        " SET status=" + FAILED + ", attempts=max_attempts," +
        " error_kind=?, last_error=?, error_at=?, executed_at=?," +
        " claimed_by=NULL, claimed_at=NULL, claim_token=NULL" +
        " WHERE job_id=? AND status=" + PROCESSING;
    return JdbcTemplate.update(conn, sql, error.kind().name(), message,
        error.occurredAt(), error.occurredAt(), jobId);
  }

  @Override
  public int cancel(Connection conn, String jobId, Instant cancelledAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.CANCELLED.code() + ", cancelled_at=?" +
        " WHERE job_id=? AND status=" + PENDING;
    return JdbcTemplate.update(conn, sql, cancelledAt, jobId);
  }

  @Override
  public int releaseStale(Connection conn, Instant claimedBefore, JobError error) {
    Objects.requireNonNull(error, "error");
    String sql = "UPDATE " + tableName() +
        " SET status = CASE WHEN attempts < max_attempts THEN " + PENDING + " ELSE " + FAILED + " END," +
        " executed_at = CASE WHEN attempts < max_attempts THEN executed_at ELSE ? END," +
        " error_kind=?, last_error=?, error_at=?," +
        " claimed_by=NULL, claimed_at=NULL, claim_token=NULL" +
        " WHERE status=" + PROCESSING + " AND claimed_at < ?";
    return JdbcTemplate.update(conn, sql, error.occurredAt(), error.kind().name(),
        truncateError(error.message()), error.occurredAt(), claimedBefore);
  }

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE job_id=?";
    return JdbcTemplate.queryOne(conn, sql, JOB_ROW_MAPPER, jobId);
  }

  @Override
  public List<Job> query(Connection conn, JobQuery query) {
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
        .append(" FROM ").append(tableName()).append(" WHERE 1=1");
    List<Object> params = new ArrayList<>(4);
    if (query.ownerId() != null) {
      sql.append(" AND owner_id=?");
      params.add(query.ownerId());
    }
    if (query.status() != null) {
      sql.append(" AND status=?");
      params.add(query.status().code());
    }
    if (query.jobType() != null) {
      sql.append(" AND job_type=?");
      params.add(query.jobType());
    }
    sql.append(" ORDER BY scheduled_time DESC LIMIT ?");
    params.add(query.limit());
    return JdbcTemplate.query(conn, sql.toString(), JOB_ROW_MAPPER, params.toArray());
  }

  @Override
  public Map<JobStatus, Long> countByStatus(Connection conn) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + tableName() + " GROUP BY status";
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    List<Map.Entry<JobStatus, Long>> rows = JdbcTemplate.query(conn, sql,
        rs -> Map.entry(JobStatus.fromCode(rs.getInt("status")), rs.getLong("cnt")));
    for (Map.Entry<JobStatus, Long> row : rows) {
      counts.put(row.getKey(), row.getValue());
    }
    return counts;
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
