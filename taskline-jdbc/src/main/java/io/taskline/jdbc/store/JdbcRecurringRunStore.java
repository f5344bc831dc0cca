package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.jdbc.TableNames;
import io.taskline.spi.RecurringRunStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC recurring run store. Standard SQL; works on H2, MySQL and PostgreSQL.
 *
 * <p>{@link #advance} is a compare-and-set on {@code last_run_time}, so when several
 * registries see the same definition due, exactly one of them advances it.
 */
public final class JdbcRecurringRunStore implements RecurringRunStore {
  private final String tableName;

  public JdbcRecurringRunStore() {
    this(TableNames.RECURRING_RUN_TABLE);
  }

  public JdbcRecurringRunStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Optional<Instant> lastRunTime(Connection conn, String definitionId) {
    String sql = "SELECT last_run_time FROM " + tableName + " WHERE definition_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> JdbcTemplate.instant(rs, "last_run_time"), definitionId);
  }

  @Override
  public void insert(Connection conn, String definitionId, Instant lastRunTime) {
    String sql = "INSERT INTO " + tableName + " (definition_id, last_run_time) VALUES (?,?)";
    JdbcTemplate.update(conn, sql, definitionId, lastRunTime);
  }

  @Override
  public int advance(Connection conn, String definitionId, Instant expected, Instant lastRunTime) {
    String sql = "UPDATE " + tableName + " SET last_run_time=? WHERE definition_id=? AND last_run_time=?";
    return JdbcTemplate.update(conn, sql, lastRunTime, definitionId, expected);
  }
}
