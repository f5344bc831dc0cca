package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.model.Credential;

import java.sql.Connection;

/**
 * PostgreSQL credential store. Upserts with {@code INSERT ... ON CONFLICT DO UPDATE}.
 */
public final class PostgresCredentialStore extends AbstractJdbcCredentialStore {

  public PostgresCredentialStore() {
    super();
  }

  public PostgresCredentialStore(String tableName) {
    super(tableName);
  }

  @Override
  public void upsert(Connection conn, Credential credential) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)" +
        " ON CONFLICT (owner_id, provider) DO UPDATE SET access_token=EXCLUDED.access_token," +
        " refresh_token=EXCLUDED.refresh_token, expires_at=EXCLUDED.expires_at, scope=EXCLUDED.scope," +
        " status=EXCLUDED.status, updated_at=EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql, insertParams(credential));
  }
}
