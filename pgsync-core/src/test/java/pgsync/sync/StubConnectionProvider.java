package pgsync.sync;

import pgsync.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out proxy connections that only count transaction calls.
 */
class StubConnectionProvider implements ConnectionProvider {
  int opened;
  int closed;
  int commits;
  int rollbacks;
  boolean failOnOpen;
  private boolean autoCommit = true;

  @Override
  public Connection getConnection() throws SQLException {
    if (failOnOpen) {
      throw new SQLException("database unavailable");
    }
    opened++;
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[] {Connection.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "commit":
              commits++;
              return null;
            case "rollback":
              rollbacks++;
              return null;
            case "close":
              closed++;
              return null;
            case "setAutoCommit":
              autoCommit = (Boolean) args[0];
              return null;
            case "getAutoCommit":
              return autoCommit;
            case "isClosed":
              return false;
            case "hashCode":
              return System.identityHashCode(proxy);
            case "equals":
              return proxy == args[0];
            case "toString":
              return "StubConnection";
            default:
              throw new UnsupportedOperationException(method.getName());
          }
        });
  }
}
