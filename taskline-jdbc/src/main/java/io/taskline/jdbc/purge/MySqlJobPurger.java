package io.taskline.jdbc.purge;

import io.taskline.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL job purger. Uses {@code DELETE ... ORDER BY ... LIMIT}, since MySQL does not
 * allow {@code LIMIT} in an {@code IN} subquery.
 */
public final class MySqlJobPurger extends AbstractJdbcJobPurger {

  public MySqlJobPurger() {
    super();
  }

  public MySqlJobPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND " + FINISHED_AT + " < ?" +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
