package pgsync.jdbc;

import java.util.Objects;

/**
 * Identifier validation for SQL that interpolates table and column names.
 */
public final class TableNames {
  public static final String DEFAULT_QUEUE_TABLE = "typesense_sync_queue";
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final String QUALIFIED_PATTERN = IDENTIFIER_PATTERN + "(\\." + IDENTIFIER_PATTERN + ")?";

  private TableNames() {}

  /** Validates a plain identifier such as a table or column name. */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /** Validates an identifier optionally qualified by a schema ({@code schema.table}). */
  public static String validateQualified(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(QUALIFIED_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /** Strips the schema qualifier, if any. */
  public static String unqualified(String tableName) {
    int dot = tableName.indexOf('.');
    return dot < 0 ? tableName : tableName.substring(dot + 1);
  }
}
