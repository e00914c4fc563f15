package pgsync.jdbc;

import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs the change-capture objects in PostgreSQL: the queue table, the trigger
 * functions and one row-level trigger per tracked source.
 *
 * <p>Tables get {@code trigger_<table>_to_typesense}, which records
 * {@code TG_TABLE_NAME}. A view gets {@code trigger_<reference>_to_<view>_typesense} on
 * its reference table, which records the view's name instead. Both read the record id
 * from the mapping's primary key column. Existing triggers are left untouched; the
 * functions are always replaced.
 *
 * <p>Installation is all-or-nothing: it runs in one transaction and validates every
 * source before changing anything.
 */
public final class PostgresSyncInstaller {
  private static final Logger logger = Logger.getLogger(PostgresSyncInstaller.class.getName());

  static final String TABLE_FUNCTION = "log_changes_for_typesense";
  static final String VIEW_FUNCTION = "log_changes_for_typesense_with_name";

  private final String queueTable;

  public PostgresSyncInstaller() {
    this(TableNames.DEFAULT_QUEUE_TABLE);
  }

  public PostgresSyncInstaller(String queueTable) {
    this.queueTable = TableNames.validate(queueTable);
  }

  /**
   * @throws IllegalStateException if a source or reference table is missing, or a view
   *                               has no reference table
   * @throws ChangeQueueException  on database errors
   */
  public SetupReport install(Connection conn, TableMappingRegistry tables) {
    boolean autoCommit = autoCommit(conn);
    try {
      conn.setAutoCommit(false);
      validateSources(conn, tables);

      boolean queueCreated = !exists(conn, queueTable);
      JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + queueTable + " ("
          + "id BIGSERIAL PRIMARY KEY, "
          + "record_id TEXT NOT NULL, "
          + "table_name TEXT NOT NULL, "
          + "operation_type VARCHAR(10) NOT NULL, "
          + "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW())");
      JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS " + queueTable + "_claim_idx ON "
          + queueTable + " (table_name, created_at, id)");
      logger.log(Level.INFO, queueCreated ? "Created queue table {0}" : "Queue table {0} already exists", queueTable);

      JdbcTemplate.execute(conn, tableFunctionSql());
      JdbcTemplate.execute(conn, viewFunctionSql());
      logger.info("Trigger functions created/updated");

      List<String> created = new ArrayList<>();
      List<String> existing = new ArrayList<>();
      for (TableMapping table : tables.all()) {
        String trigger = triggerName(table);
        String target = triggerTarget(table);
        if (triggerExists(conn, trigger, target)) {
          existing.add(trigger);
          logger.log(Level.INFO, "Trigger {0} on {1} already exists", new Object[] {trigger, target});
          continue;
        }
        JdbcTemplate.execute(conn, "CREATE TRIGGER " + trigger
            + " AFTER INSERT OR UPDATE OR DELETE ON " + target
            + " FOR EACH ROW EXECUTE FUNCTION " + triggerCall(table));
        created.add(trigger);
        logger.log(Level.INFO, "Created trigger {0} on {1} for ''{2}''", new Object[] {trigger, target, table.name()});
      }

      conn.commit();
      return new SetupReport(queueCreated, created, existing);
    } catch (SQLException e) {
      rollback(conn);
      throw new ChangeQueueException("Database setup failed", e);
    } catch (RuntimeException e) {
      rollback(conn);
      throw e;
    } finally {
      restoreAutoCommit(conn, autoCommit);
    }
  }

  /** Whether a table or view is visible on the connection's search path. */
  public boolean exists(Connection conn, String relation) {
    return JdbcTemplate.queryForObject(conn, "SELECT to_regclass(?) IS NOT NULL",
        rs -> rs.getBoolean(1), TableNames.validateQualified(relation));
  }

  public boolean isView(Connection conn, String relation) {
    List<Boolean> kinds = JdbcTemplate.query(conn,
        "SELECT relkind IN ('v', 'm') FROM pg_class WHERE oid = to_regclass(?)",
        rs -> rs.getBoolean(1), TableNames.validateQualified(relation));
    return !kinds.isEmpty() && kinds.get(0);
  }

  public boolean triggerExists(Connection conn, String triggerName, String relation) {
    return JdbcTemplate.queryForObject(conn,
        "SELECT EXISTS (SELECT 1 FROM pg_trigger WHERE tgname = ? AND tgrelid = to_regclass(?))",
        rs -> rs.getBoolean(1), triggerName, relation);
  }

  /** Whether the change trigger of {@code table} is installed on its source (or reference table). */
  public boolean triggerInstalled(Connection conn, TableMapping table) {
    return triggerExists(conn, triggerName(table), triggerTarget(table));
  }

  static String triggerName(TableMapping table) {
    String name = TableNames.unqualified(table.name());
    if (table.isViewBacked()) {
      return "trigger_" + TableNames.unqualified(table.referenceTable()) + "_to_" + name + "_typesense";
    }
    return "trigger_" + name + "_to_typesense";
  }

  static String triggerTarget(TableMapping table) {
    return TableNames.validateQualified(table.isViewBacked() ? table.referenceTable() : table.name());
  }

  static String triggerCall(TableMapping table) {
    String pk = TableNames.validate(table.primaryKey());
    if (table.isViewBacked() || table.name().contains(".")) {
      return VIEW_FUNCTION + "('" + TableNames.validateQualified(table.name()) + "', '" + pk + "')";
    }
    return TABLE_FUNCTION + "('" + pk + "')";
  }

  private void validateSources(Connection conn, TableMappingRegistry tables) {
    List<String> missing = new ArrayList<>();
    List<String> missingReferences = new ArrayList<>();
    for (TableMapping table : tables.all()) {
      if (!exists(conn, table.name())) {
        missing.add(table.name());
        continue;
      }
      if (isView(conn, table.name()) && !table.isViewBacked()) {
        throw new IllegalStateException("View '" + table.name() + "' requires a reference table");
      }
      if (table.isViewBacked() && !exists(conn, table.referenceTable())) {
        missingReferences.add(table.name() + " -> " + table.referenceTable());
      }
    }
    if (!missing.isEmpty()) {
      throw new IllegalStateException("Source tables do not exist: " + String.join(", ", missing));
    }
    if (!missingReferences.isEmpty()) {
      throw new IllegalStateException("Reference tables do not exist: " + String.join(", ", missingReferences));
    }
  }

  private String tableFunctionSql() {
    return "CREATE OR REPLACE FUNCTION " + TABLE_FUNCTION + "() RETURNS TRIGGER AS $$\n"
        + "DECLARE\n"
        + "  pk_column TEXT := COALESCE(TG_ARGV[0], 'id');\n"
        + "BEGIN\n"
        + "  IF (TG_OP = 'DELETE') THEN\n"
        + "    INSERT INTO " + queueTable + " (record_id, table_name, operation_type)\n"
        + "    VALUES (to_jsonb(OLD) ->> pk_column, TG_TABLE_NAME, 'DELETE');\n"
        + "    RETURN OLD;\n"
        + "  ELSE\n"
        + "    INSERT INTO " + queueTable + " (record_id, table_name, operation_type)\n"
        + "    VALUES (to_jsonb(NEW) ->> pk_column, TG_TABLE_NAME, TG_OP);\n"
        + "    RETURN NEW;\n"
        + "  END IF;\n"
        + "END;\n"
        + "$$ LANGUAGE plpgsql";
  }

  private String viewFunctionSql() {
    return "CREATE OR REPLACE FUNCTION " + VIEW_FUNCTION + "() RETURNS TRIGGER AS $$\n"
        + "DECLARE\n"
        + "  target_table_name TEXT := TG_ARGV[0];\n"
        + "  pk_column TEXT := COALESCE(TG_ARGV[1], 'id');\n"
        + "BEGIN\n"
        + "  IF (TG_OP = 'DELETE') THEN\n"
        + "    INSERT INTO " + queueTable + " (record_id, table_name, operation_type)\n"
        + "    VALUES (to_jsonb(OLD) ->> pk_column, target_table_name, 'DELETE');\n"
        + "    RETURN OLD;\n"
        + "  ELSE\n"
        + "    INSERT INTO " + queueTable + " (record_id, table_name, operation_type)\n"
        + "    VALUES (to_jsonb(NEW) ->> pk_column, target_table_name, TG_OP);\n"
        + "    RETURN NEW;\n"
        + "  END IF;\n"
        + "END;\n"
        + "$$ LANGUAGE plpgsql";
  }

  private static boolean autoCommit(Connection conn) {
    try {
      return conn.getAutoCommit();
    } catch (SQLException e) {
      throw new ChangeQueueException("Failed to read auto-commit mode", e);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit mode", e);
    }
  }

  private static void rollback(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }
}
