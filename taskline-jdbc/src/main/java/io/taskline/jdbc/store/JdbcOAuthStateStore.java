package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.jdbc.TableNames;
import io.taskline.model.OAuthState;
import io.taskline.spi.OAuthStateStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC OAuth state store. Standard SQL; works on H2, MySQL and PostgreSQL.
 *
 * <p>{@link #consume} reads the row and then deletes it; only the caller whose delete
 * removed the row gets the state back.
 */
public final class JdbcOAuthStateStore implements OAuthStateStore {
  private static final JdbcTemplate.RowMapper<OAuthState> STATE_ROW_MAPPER = rs -> new OAuthState(
      rs.getString("state"),
      rs.getString("owner_id"),
      rs.getString("provider"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "expires_at"));

  private final String tableName;

  public JdbcOAuthStateStore() {
    this(TableNames.OAUTH_STATE_TABLE);
  }

  public JdbcOAuthStateStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void insert(Connection conn, OAuthState state) {
    String sql = "INSERT INTO " + tableName + " (state, owner_id, provider, created_at, expires_at)" +
        " VALUES (?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        state.state(), state.ownerId(), state.provider(), state.createdAt(), state.expiresAt());
  }

  @Override
  public Optional<OAuthState> consume(Connection conn, String state) {
    String select = "SELECT state, owner_id, provider, created_at, expires_at FROM " + tableName +
        " WHERE state=?";
    Optional<OAuthState> found = JdbcTemplate.queryOne(conn, select, STATE_ROW_MAPPER, state);
    if (found.isEmpty()) {
      return found;
    }
    int deleted = JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE state=?", state);
    return deleted == 1 ? found : Optional.empty();
  }

  @Override
  public int purgeExpired(Connection conn, Instant now) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE expires_at <= ?", now);
  }
}
