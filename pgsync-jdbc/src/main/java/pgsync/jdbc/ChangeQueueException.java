package pgsync.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised while reading or writing the
 * change queue and the tracked source tables.
 */
public final class ChangeQueueException extends RuntimeException {
  public ChangeQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
