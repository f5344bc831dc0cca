package io.taskline.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String JOB_TABLE = "taskline_job";
  public static final String CREDENTIAL_TABLE = "taskline_credential";
  public static final String RECURRING_RUN_TABLE = "taskline_recurring_run";
  public static final String OAUTH_STATE_TABLE = "taskline_oauth_state";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns {@code tableName} if it is a plain SQL identifier; table names are
   * concatenated into SQL, so anything else is rejected.
   *
   * @throws IllegalArgumentException if the name is not a plain identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
