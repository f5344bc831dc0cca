package io.taskline.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC job stores with auto-detection support.
 *
 * <p>Job stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.taskline.jdbc.store.AbstractJdbcJobStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcJobStore store = JdbcJobStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcJobStore store = JdbcJobStores.get("postgresql");
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES;
  private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcJobStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcJobStores() {
  }

  /**
   * Returns all registered job stores.
   */
  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * Gets a job store by name.
   *
   * @param name job store name (case-insensitive)
   * @return the job store
   * @throws IllegalArgumentException if no job store is registered under that name
   */
  public static AbstractJdbcJobStore get(String name) {
    AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown job store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the job store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no job store matches the JDBC URL
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
  }

  /**
   * Auto-detects the job store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no job store matches
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcJobStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix)) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
