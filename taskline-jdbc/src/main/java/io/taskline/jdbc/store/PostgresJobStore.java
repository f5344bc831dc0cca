package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.model.Job;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL job store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim; concurrent schedulers skip each other's rows instead of
 * blocking on them.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<Job> claimDue(Connection conn, String workerId, Instant now, int limit) {
    Objects.requireNonNull(workerId, "workerId");
    String sql = "UPDATE " + tableName() +
        " SET status=" + PROCESSING + ", attempts=attempts+1, claimed_by=?, claimed_at=?, claim_token=?" +
        " WHERE job_id IN (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status=" + PENDING + " AND scheduled_time <= ?" +
        " ORDER BY scheduled_time LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<Job> claimed = JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER,
        workerId, now, newClaimToken(), now, limit);
    // RETURNING order is unspecified
    return sortByScheduledTime(claimed);
  }
}
