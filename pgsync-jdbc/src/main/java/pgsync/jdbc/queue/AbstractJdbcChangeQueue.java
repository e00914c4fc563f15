package pgsync.jdbc.queue;

import pgsync.jdbc.ChangeQueueException;
import pgsync.jdbc.JdbcTemplate;
import pgsync.jdbc.TableNames;
import pgsync.mapping.TableMapping;
import pgsync.model.OperationType;
import pgsync.model.QueueEntry;
import pgsync.model.QueueStatus;
import pgsync.spi.ChangeQueue;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base JDBC change queue with standard SQL implementations.
 *
 * <p>Subclasses choose the row-locking clause of the claim and may override the
 * existence check. Register custom implementations via
 * {@code META-INF/services/pgsync.jdbc.queue.AbstractJdbcChangeQueue}.
 *
 * @see JdbcChangeQueues
 */
public abstract class AbstractJdbcChangeQueue implements ChangeQueue {
  private static final int MAX_IN_LIST = 1000;

  protected static final JdbcTemplate.RowMapper<QueueEntry> ENTRY_ROW_MAPPER = rs -> new QueueEntry(
      rs.getLong("id"),
      rs.getString("record_id"),
      rs.getString("table_name"),
      OperationType.fromCode(rs.getString("operation_type")),
      toInstant(rs.getTimestamp("created_at")));

  private final String tableName;

  protected AbstractJdbcChangeQueue() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  protected AbstractJdbcChangeQueue(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this queue implementation (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this implementation handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this queue reading the given table.
   */
  public abstract AbstractJdbcChangeQueue withTableName(String tableName);

  /**
   * Locking clause appended to the claim query.
   */
  protected String lockClause() {
    return " FOR UPDATE";
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public boolean exists(Connection conn) {
    try {
      DatabaseMetaData meta = conn.getMetaData();
      for (String candidate : List.of(tableName, tableName.toLowerCase(Locale.ROOT), tableName.toUpperCase(Locale.ROOT))) {
        try (ResultSet rs = meta.getTables(null, null, candidate, null)) {
          if (rs.next()) {
            return true;
          }
        }
      }
      return false;
    } catch (SQLException e) {
      throw new ChangeQueueException("Failed to check for queue table " + tableName, e);
    }
  }

  @Override
  public long pendingCount(Connection conn, Collection<String> tableNames) {
    Objects.requireNonNull(tableNames, "tableNames");
    if (tableNames.isEmpty()) {
      return JdbcTemplate.queryForObject(conn, "SELECT COUNT(*) FROM " + tableName, rs -> rs.getLong(1));
    }
    String sql = "SELECT COUNT(*) FROM " + tableName
        + " WHERE table_name IN (" + JdbcTemplate.placeholders(tableNames.size()) + ")";
    return JdbcTemplate.queryForObject(conn, sql, rs -> rs.getLong(1), tableNames.toArray());
  }

  @Override
  public List<QueueEntry> claim(Connection conn, Collection<String> tableNames, Set<Long> excludedIds, int limit) {
    Objects.requireNonNull(tableNames, "tableNames");
    if (tableNames.isEmpty()) {
      throw new IllegalArgumentException("tableNames must not be empty");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    List<Object> params = new ArrayList<>(tableNames);
    StringBuilder sql = new StringBuilder()
        .append("SELECT id, record_id, table_name, operation_type, created_at FROM ").append(tableName)
        .append(" WHERE table_name IN (").append(JdbcTemplate.placeholders(tableNames.size())).append(")");
    if (excludedIds != null && !excludedIds.isEmpty()) {
      sql.append(" AND id NOT IN (").append(JdbcTemplate.placeholders(excludedIds.size())).append(")");
      params.addAll(excludedIds);
    }
    sql.append(" ORDER BY created_at NULLS LAST, id LIMIT ?").append(lockClause());
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), ENTRY_ROW_MAPPER, params.toArray());
  }

  @Override
  public int delete(Connection conn, Collection<Long> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    List<Long> all = new ArrayList<>(ids);
    int deleted = 0;
    for (int from = 0; from < all.size(); from += MAX_IN_LIST) {
      List<Long> chunk = all.subList(from, Math.min(all.size(), from + MAX_IN_LIST));
      String sql = "DELETE FROM " + tableName + " WHERE id IN (" + JdbcTemplate.placeholders(chunk.size()) + ")";
      deleted += JdbcTemplate.update(conn, sql, chunk.toArray());
    }
    return deleted;
  }

  @Override
  public QueueStatus status(Connection conn) {
    if (!exists(conn)) {
      return QueueStatus.missing();
    }
    Object[] summary = JdbcTemplate.queryForObject(conn,
        "SELECT COUNT(*), MIN(created_at), MAX(created_at) FROM " + tableName,
        rs -> new Object[] {rs.getLong(1), toInstant(rs.getTimestamp(2)), toInstant(rs.getTimestamp(3))});

    Map<String, Map<OperationType, Long>> breakdown = new LinkedHashMap<>();
    JdbcTemplate.query(conn,
        "SELECT table_name, operation_type, COUNT(*) FROM " + tableName
            + " GROUP BY table_name, operation_type ORDER BY table_name, operation_type",
        rs -> breakdown.computeIfAbsent(rs.getString(1), k -> new LinkedHashMap<>())
            .put(OperationType.fromCode(rs.getString(2)), rs.getLong(3)));

    return new QueueStatus(true, (Long) summary[0], (Instant) summary[1], (Instant) summary[2], breakdown);
  }

  /**
   * Enqueues an {@code INSERT} for every row of the mapped source (the view itself for
   * view-backed mappings), ordered by primary key.
   */
  @Override
  public int backfill(Connection conn, TableMapping table) {
    String source = TableNames.validateQualified(table.name());
    String pk = TableNames.validate(table.primaryKey());
    String sql = "INSERT INTO " + tableName + " (record_id, table_name, operation_type)"
        + " SELECT CAST(" + pk + " AS VARCHAR), CAST(? AS VARCHAR), 'INSERT' FROM " + source + " ORDER BY " + pk;
    return JdbcTemplate.update(conn, sql, table.name());
  }

  protected static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
