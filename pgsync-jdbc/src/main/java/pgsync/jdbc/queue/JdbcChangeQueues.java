package pgsync.jdbc.queue;

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
 * Registry for JDBC change queues with auto-detection support.
 *
 * <p>Implementations are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/pgsync.jdbc.queue.AbstractJdbcChangeQueue}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcChangeQueue queue = JdbcChangeQueues.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom queue table
 * AbstractJdbcChangeQueue queue = JdbcChangeQueues.detect("jdbc:postgresql://localhost/app")
 *     .withTableName("search_sync_queue");
 *
 * // Get by name
 * AbstractJdbcChangeQueue queue = JdbcChangeQueues.get("postgresql");
 * }</pre>
 */
public final class JdbcChangeQueues {

  private static final List<AbstractJdbcChangeQueue> QUEUES;
  private static final Map<String, AbstractJdbcChangeQueue> BY_NAME = new ConcurrentHashMap<>();

  static {
    QUEUES = ServiceLoader.load(AbstractJdbcChangeQueue.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcChangeQueue queue : QUEUES) {
      BY_NAME.put(queue.name().toLowerCase(Locale.ROOT), queue);
    }
  }

  private JdbcChangeQueues() {
  }

  /**
   * Returns all registered change queues.
   */
  public static List<AbstractJdbcChangeQueue> all() {
    return QUEUES;
  }

  /**
   * Gets a change queue by name.
   *
   * @param name queue name (case-insensitive)
   * @throws IllegalArgumentException if no queue is registered under that name
   */
  public static AbstractJdbcChangeQueue get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcChangeQueue queue = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (queue == null) {
      throw new IllegalArgumentException("Unknown change queue: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return queue;
  }

  /**
   * Auto-detects the change queue from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no queue matches
   */
  public static AbstractJdbcChangeQueue detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect change queue from DataSource", e);
    }
  }

  /**
   * Auto-detects the change queue from a JDBC URL.
   *
   * @throws IllegalArgumentException if no queue matches
   */
  public static AbstractJdbcChangeQueue detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcChangeQueue queue : QUEUES) {
      for (String prefix : queue.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return queue;
        }
      }
    }
    throw new IllegalArgumentException("No change queue found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return QUEUES.stream()
        .flatMap(q -> q.jdbcUrlPrefixes().stream())
        .toList();
  }
}
