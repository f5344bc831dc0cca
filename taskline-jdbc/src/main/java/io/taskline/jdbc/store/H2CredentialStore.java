package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.model.Credential;

import java.sql.Connection;

/**
 * H2 credential store. Upserts with {@code MERGE INTO ... KEY}.
 */
public final class H2CredentialStore extends AbstractJdbcCredentialStore {

  public H2CredentialStore() {
    super();
  }

  public H2CredentialStore(String tableName) {
    super(tableName);
  }

  @Override
  public void upsert(Connection conn, Credential credential) {
    String sql = "MERGE INTO " + tableName() + " (" + COLUMNS + ") KEY (owner_id, provider)" +
        " VALUES (?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, insertParams(credential));
  }
}
