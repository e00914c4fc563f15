package pgsync.jdbc.queue;

import pgsync.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL change queue.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED}, so concurrent consumers receive
 * disjoint batches without blocking each other.
 */
public final class PostgresChangeQueue extends AbstractJdbcChangeQueue {

  public PostgresChangeQueue() {
    super();
  }

  public PostgresChangeQueue(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcChangeQueue withTableName(String tableName) {
    return new PostgresChangeQueue(tableName);
  }

  @Override
  protected String lockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }

  /** Resolves the table through the connection's search path. */
  @Override
  public boolean exists(Connection conn) {
    return JdbcTemplate.queryForObject(conn, "SELECT to_regclass(?) IS NOT NULL",
        rs -> rs.getBoolean(1), tableName());
  }
}
