package pgsync.jdbc;

import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.spi.ChangeQueue;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queues every existing source row for an initial load.
 *
 * <p>Each table is backfilled and committed on its own; a table that fails (for
 * example because it does not exist) is logged and skipped.
 */
public final class QueueBackfill {
  private static final Logger logger = Logger.getLogger(QueueBackfill.class.getName());

  private final ChangeQueue changeQueue;

  public QueueBackfill(ChangeQueue changeQueue) {
    this.changeQueue = Objects.requireNonNull(changeQueue, "changeQueue");
  }

  /**
   * @return entries queued per table; failed tables are absent
   */
  public Map<String, Integer> run(Connection conn, TableMappingRegistry tables) throws SQLException {
    Map<String, Integer> queued = new LinkedHashMap<>();
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      for (TableMapping table : tables.all()) {
        try {
          int count = changeQueue.backfill(conn, table);
          conn.commit();
          queued.put(table.name(), count);
          logger.log(Level.INFO, "Queued {0} records from ''{1}''", new Object[] {count, table.name()});
        } catch (ChangeQueueException | IllegalArgumentException e) {
          conn.rollback();
          logger.log(Level.WARNING, "Failed to queue records from '" + table.name() + "'", e);
        }
      }
    } finally {
      conn.setAutoCommit(autoCommit);
    }
    int total = queued.values().stream().mapToInt(Integer::intValue).sum();
    logger.log(Level.INFO, "Backfill completed: {0} records queued", total);
    return queued;
  }
}
