package io.eventlog.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event log stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.eventlog.jdbc.store.AbstractJdbcEventLogStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventLogStore store = JdbcEventLogStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcEventLogStore store = JdbcEventLogStores.detect("jdbc:postgresql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcEventLogStore store = JdbcEventLogStores.get("h2");
 * }</pre>
 */
public final class JdbcEventLogStores {

  private static final List<AbstractJdbcEventLogStore> STORES;
  private static final Map<String, AbstractJdbcEventLogStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcEventLogStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventLogStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcEventLogStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcEventLogStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcEventLogStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcEventLogStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown event log store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcEventLogStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event log store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcEventLogStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcEventLogStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No event log store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
