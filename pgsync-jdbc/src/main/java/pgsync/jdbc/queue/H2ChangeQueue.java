package pgsync.jdbc.queue;

import java.util.List;

/**
 * H2 change queue. Primarily for testing.
 *
 * <p>Claims with a plain {@code FOR UPDATE}: concurrent consumers wait for each other
 * instead of skipping locked rows.
 */
public final class H2ChangeQueue extends AbstractJdbcChangeQueue {

  public H2ChangeQueue() {
    super();
  }

  public H2ChangeQueue(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcChangeQueue withTableName(String tableName) {
    return new H2ChangeQueue(tableName);
  }
}
