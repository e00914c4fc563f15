package pgsync.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides the JDBC connection a sync run works on.
 *
 * <p>Callers are responsible for closing the returned connection. A
 * {@code DataSource}-backed implementation lives in the {@code pgsync-jdbc} module.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
