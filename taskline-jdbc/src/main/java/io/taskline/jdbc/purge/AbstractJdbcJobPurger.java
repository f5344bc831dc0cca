package io.taskline.jdbc.purge;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.jdbc.TableNames;
import io.taskline.model.JobStatus;
import io.taskline.spi.JobPurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * Base JDBC job purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Subclasses may override {@link #purge} for databases that support more
 * efficient syntax (e.g. MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see H2JobPurger
 * @see MySqlJobPurger
 * @see PostgresJobPurger
 */
public abstract class AbstractJdbcJobPurger implements JobPurger {

  protected static final String TERMINAL_STATUS_IN = "(" + JobStatus.COMPLETED.code() + ","
      + JobStatus.FAILED.code() + "," + JobStatus.CANCELLED.code() + ")";

  protected static final String FINISHED_AT = "COALESCE(executed_at, cancelled_at, created_at)";

  private final String tableName;

  protected AbstractJdbcJobPurger() {
    this(TableNames.JOB_TABLE);
  }

  protected AbstractJdbcJobPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Creates the purger for a database name as reported by
   * {@link io.taskline.jdbc.store.AbstractJdbcJobStore#name()}.
   *
   * @throws IllegalArgumentException for an unsupported database
   */
  public static AbstractJdbcJobPurger forDatabase(String name, String tableName) {
    return switch (name) {
      case "h2" -> new H2JobPurger(tableName);
      case "mysql" -> new MySqlJobPurger(tableName);
      case "postgresql" -> new PostgresJobPurger(tableName);
      default -> throw new IllegalArgumentException("No job purger available for database: " + name);
    };
  }

  /**
   * Deletes terminal jobs finished before {@code before}, up to {@code limit} rows.
   *
   * <p>Default implementation uses a subquery to limit the batch size, which
   * works for H2 and PostgreSQL. MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE job_id IN (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND " + FINISHED_AT + " < ?" +
        " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
