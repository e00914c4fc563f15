package pgsync.spi;

import java.sql.Connection;
import java.util.List;
import java.util.Map;

import pgsync.mapping.TableMapping;

/**
 * Reads current source rows for a set of record ids.
 */
public interface RowFetcher {

    /**
     * Fetches rows whose primary key, compared as text, is one of {@code recordIds}.
     *
     * @param conn      the JDBC connection
     * @param table     the mapped source (table or view)
     * @param recordIds record ids as recorded in the queue
     * @return rows keyed by record id; ids without a row are absent
     */
    Map<String, Map<String, Object>> fetch(Connection conn, TableMapping table, List<String> recordIds);

    /**
     * Counts rows in the mapped source.
     */
    long count(Connection conn, TableMapping table);
}
