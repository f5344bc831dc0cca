package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.model.Credential;

import java.sql.Connection;

/**
 * MySQL credential store. Upserts with {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlCredentialStore extends AbstractJdbcCredentialStore {

  public MySqlCredentialStore() {
    super();
  }

  public MySqlCredentialStore(String tableName) {
    super(tableName);
  }

  @Override
  public void upsert(Connection conn, Credential credential) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE access_token=VALUES(access_token), refresh_token=VALUES(refresh_token)," +
        " expires_at=VALUES(expires_at), scope=VALUES(scope), status=VALUES(status)," +
        " updated_at=VALUES(updated_at)";
    JdbcTemplate.update(conn, sql, insertParams(credential));
  }
}
