package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.model.Job;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so the claim uses
 * {@code UPDATE...ORDER BY...LIMIT} followed by a {@code SELECT} of the rows carrying
 * this claim's token. InnoDB row locks taken by the update keep concurrent claims apart.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public List<Job> claimDue(Connection conn, String workerId, Instant now, int limit) {
    Objects.requireNonNull(workerId, "workerId");
    String token = newClaimToken();
    String claimSql = "UPDATE " + tableName() +
        " SET status=" + PROCESSING + ", attempts=attempts+1, claimed_by=?, claimed_at=?, claim_token=?" +
        " WHERE status=" + PENDING + " AND scheduled_time <= ?" +
        " ORDER BY scheduled_time LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql, workerId, now, token, now, limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, token);
  }
}
