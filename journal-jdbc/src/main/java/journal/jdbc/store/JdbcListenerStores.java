package journal.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC listener stores with auto-detection support.
 *
 * <p>Listener stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/journal.jdbc.store.AbstractJdbcListenerStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcListenerStore store = JdbcListenerStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcListenerStore store = JdbcListenerStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name, bound to a custom table
 * AbstractJdbcListenerStore store = JdbcListenerStores.get("postgresql").withTableName("bot_outputs");
 * }</pre>
 */
public final class JdbcListenerStores {

  private static final List<AbstractJdbcListenerStore> STORES;
  private static final Map<String, AbstractJdbcListenerStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcListenerStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcListenerStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcListenerStores() {
  }

  /**
   * Returns all registered listener stores.
   */
  public static List<AbstractJdbcListenerStore> all() {
    return STORES;
  }

  /**
   * Gets a listener store by name.
   *
   * @param name listener store name (case-insensitive)
   * @return the listener store
   * @throws IllegalArgumentException if no listener store found
   */
  public static AbstractJdbcListenerStore get(String name) {
    AbstractJdbcListenerStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown listener store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the listener store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected listener store
   * @throws IllegalStateException if detection fails or no matching listener store
   */
  public static AbstractJdbcListenerStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect listener store from DataSource", e);
    }
    try {
      return detect(url);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Auto-detects the listener store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected listener store
   * @throws IllegalArgumentException if no matching listener store found
   */
  public static AbstractJdbcListenerStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcListenerStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No listener store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
