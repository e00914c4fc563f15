package pgsync.spi;

import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import pgsync.mapping.TableMapping;
import pgsync.model.QueueEntry;
import pgsync.model.QueueStatus;

/**
 * Access to the change queue table that the source triggers append to.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries: {@link #claim} and {@link #delete} are meant to run in the
 * same transaction. Implementations live in the {@code pgsync-jdbc} module.
 */
public interface ChangeQueue {

    /**
     * @return whether the queue table exists
     */
    boolean exists(Connection conn);

    /**
     * Counts entries that a claim over {@code tableNames} could return.
     *
     * @param conn       the JDBC connection
     * @param tableNames tables to count; empty counts the whole queue
     */
    long pendingCount(Connection conn, Collection<String> tableNames);

    /**
     * Claims up to {@code limit} entries for the given tables, oldest first (by
     * {@code created_at} with nulls last, then {@code id}), skipping ids in {@code excludedIds}.
     *
     * <p>Rows are locked for the enclosing transaction. Entries locked by another
     * consumer are skipped rather than waited on where the database supports it.
     *
     * @param conn        the JDBC connection, inside a transaction
     * @param tableNames  tables to claim from; must not be empty
     * @param excludedIds queue ids not to return
     * @param limit       maximum number of entries
     * @return claimed entries in claim order
     */
    List<QueueEntry> claim(Connection conn, Collection<String> tableNames, Set<Long> excludedIds, int limit);

    /**
     * Claims without exclusions.
     */
    default List<QueueEntry> claim(Connection conn, Collection<String> tableNames, int limit) {
        return claim(conn, tableNames, Set.of(), limit);
    }

    /**
     * Deletes entries by id.
     *
     * @return the number of rows removed
     */
    int delete(Connection conn, Collection<Long> ids);

    /**
     * Summarizes the queue. Returns {@link QueueStatus#missing()} when the table does
     * not exist.
     */
    QueueStatus status(Connection conn);

    /**
     * Enqueues an {@code INSERT} entry for every existing row of the mapped source,
     * ordered by its primary key.
     *
     * @return the number of entries added
     */
    int backfill(Connection conn, TableMapping table);
}
