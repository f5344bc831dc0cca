package io.taskline.jdbc.store;

import io.taskline.jdbc.JdbcTemplate;
import io.taskline.jdbc.TableNames;
import io.taskline.model.Credential;
import io.taskline.model.CredentialStatus;
import io.taskline.spi.CredentialStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Base JDBC credential store. Subclasses supply the database-specific
 * {@link #upsert} statement; everything else is standard SQL.
 *
 * <p>Scopes are stored as a single space-separated, sorted string.
 */
public abstract class AbstractJdbcCredentialStore implements CredentialStore {

  protected static final String COLUMNS =
      "owner_id, provider, access_token, refresh_token, expires_at, scope, status, updated_at";

  protected static final JdbcTemplate.RowMapper<Credential> CREDENTIAL_ROW_MAPPER = rs -> new Credential(
      rs.getString("owner_id"),
      rs.getString("provider"),
      rs.getString("access_token"),
      rs.getString("refresh_token"),
      JdbcTemplate.instant(rs, "expires_at"),
      parseScope(rs.getString("scope")),
      CredentialStatus.fromCode(rs.getInt("status")),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;

  protected AbstractJdbcCredentialStore() {
    this(TableNames.CREDENTIAL_TABLE);
  }

  protected AbstractJdbcCredentialStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Creates the credential store for a database name as reported by
   * {@link AbstractJdbcJobStore#name()}.
   *
   * @throws IllegalArgumentException for an unsupported database
   */
  public static AbstractJdbcCredentialStore forDatabase(String name) {
    return forDatabase(name, TableNames.CREDENTIAL_TABLE);
  }

  /**
   * As {@link #forDatabase(String)}, using a custom table name.
   */
  public static AbstractJdbcCredentialStore forDatabase(String name, String tableName) {
    return switch (name) {
      case "h2" -> new H2CredentialStore(tableName);
      case "mysql" -> new MySqlCredentialStore(tableName);
      case "postgresql" -> new PostgresCredentialStore(tableName);
      default -> throw new IllegalArgumentException("No credential store available for database: " + name);
    };
  }

  @Override
  public Optional<Credential> get(Connection conn, String ownerId, String provider) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE owner_id=? AND provider=?";
    return JdbcTemplate.queryOne(conn, sql, CREDENTIAL_ROW_MAPPER, ownerId, provider);
  }

  @Override
  public int update(Connection conn, Credential credential) {
    String sql = "UPDATE " + tableName() +
        " SET access_token=?, refresh_token=?, expires_at=?, scope=?, status=?, updated_at=?" +
        " WHERE owner_id=? AND provider=?";
    return JdbcTemplate.update(conn, sql,
        credential.accessToken(), credential.refreshToken(), credential.expiresAt(),
        formatScope(credential.scope()), credential.status().code(), credential.updatedAt(),
        credential.ownerId(), credential.provider());
  }

  @Override
  public int markStatus(Connection conn, String ownerId, String provider, CredentialStatus status,
      Instant updatedAt) {
    String sql = "UPDATE " + tableName() + " SET status=?, updated_at=? WHERE owner_id=? AND provider=?";
    return JdbcTemplate.update(conn, sql, status.code(), updatedAt, ownerId, provider);
  }

  @Override
  public List<Credential> listExpiring(Connection conn, Instant cutoff) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status IN (" + CredentialStatus.ACTIVE.code() + "," + CredentialStatus.EXPIRING.code() + ")" +
        " AND expires_at <= ? ORDER BY expires_at";
    return JdbcTemplate.query(conn, sql, CREDENTIAL_ROW_MAPPER, cutoff);
  }

  @Override
  public List<Credential> listByOwner(Connection conn, String ownerId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE owner_id=? ORDER BY provider";
    return JdbcTemplate.query(conn, sql, CREDENTIAL_ROW_MAPPER, ownerId);
  }

  /** Parameters for {@code INSERT (COLUMNS) VALUES (?,?,?,?,?,?,?,?)}. */
  protected static Object[] insertParams(Credential credential) {
    return new Object[]{
        credential.ownerId(), credential.provider(), credential.accessToken(), credential.refreshToken(),
        credential.expiresAt(), formatScope(credential.scope()), credential.status().code(),
        credential.updatedAt()};
  }

  static String formatScope(Set<String> scope) {
    return scope.isEmpty() ? null : String.join(" ", new TreeSet<>(scope));
  }

  static Set<String> parseScope(String scope) {
    if (scope == null || scope.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(scope.trim().split("\\s+")).collect(Collectors.toUnmodifiableSet());
  }
}
