package workqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC queue stores with auto-detection support.
 *
 * <p>Queue stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/workqueue.jdbc.store.AbstractJdbcQueueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect("jdbc:mysql://localhost/mydb", "jobs");
 *
 * // Get by name
 * AbstractJdbcQueueStore store = JdbcQueueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcQueueStores {

  private static final List<AbstractJdbcQueueStore> STORES;
  private static final Map<String, AbstractJdbcQueueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcQueueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcQueueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcQueueStores() {
  }

  /**
   * Returns all registered queue stores.
   */
  public static List<AbstractJdbcQueueStore> all() {
    return STORES;
  }

  /**
   * Gets a queue store by name.
   *
   * @param name queue store name (case-insensitive)
   * @throws IllegalArgumentException if no queue store found
   */
  public static AbstractJdbcQueueStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcQueueStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown queue store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the queue store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no queue store matches the URL
   */
  public static AbstractJdbcQueueStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect queue store from DataSource", e);
    }
  }

  /**
   * Auto-detects the queue store from a DataSource, bound to {@code tableName}.
   */
  public static AbstractJdbcQueueStore detect(DataSource dataSource, String tableName) {
    return detect(dataSource).withTableName(tableName);
  }

  /**
   * Auto-detects the queue store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching queue store found
   */
  public static AbstractJdbcQueueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcQueueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No queue store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the queue store from a JDBC URL, bound to {@code tableName}.
   */
  public static AbstractJdbcQueueStore detect(String jdbcUrl, String tableName) {
    return detect(jdbcUrl).withTableName(tableName);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
