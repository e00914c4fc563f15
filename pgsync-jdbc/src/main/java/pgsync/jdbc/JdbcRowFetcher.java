package pgsync.jdbc;

import pgsync.mapping.TableMapping;
import pgsync.spi.RowFetcher;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads source rows with plain JDBC.
 *
 * <p>Queued record ids are bound with the primary key's own SQL type (integers,
 * decimals, UUIDs and character types) so the lookup can use the key's index; an id
 * that cannot be parsed as that type has no row. Keys of other types are compared
 * as text. Column values are returned as the driver reports them, except:
 * <ul>
 *   <li>timestamps become {@link LocalDateTime} or {@link OffsetDateTime}, dates
 *       {@link LocalDate} and times {@link LocalTime}</li>
 *   <li>SQL arrays become lists</li>
 *   <li>CLOBs and driver-specific objects (json, vector, ...) are read as text</li>
 * </ul>
 */
public final class JdbcRowFetcher implements RowFetcher {
  private static final Logger logger = Logger.getLogger(JdbcRowFetcher.class.getName());
  private static final int MAX_IN_LIST = 1000;

  @Override
  public Map<String, Map<String, Object>> fetch(Connection conn, TableMapping table, List<String> recordIds) {
    Map<String, Map<String, Object>> rows = new LinkedHashMap<>();
    if (recordIds.isEmpty()) {
      return rows;
    }
    String source = TableNames.validateQualified(table.name());
    String pk = TableNames.validate(table.primaryKey());
    KeyType keyType = keyType(conn, source, pk);
    for (int from = 0; from < recordIds.size(); from += MAX_IN_LIST) {
      List<Object> keys = new ArrayList<>();
      for (String recordId : recordIds.subList(from, Math.min(recordIds.size(), from + MAX_IN_LIST))) {
        Object key = keyType.parse(recordId);
        if (key == null) {
          logger.log(Level.FINE, "Record id ''{0}'' is not a valid {1} key of {2}",
              new Object[] {recordId, keyType, source});
        } else {
          keys.add(key);
        }
      }
      if (keys.isEmpty()) {
        continue;
      }
      String column = keyType == KeyType.TEXT ? "CAST(" + pk + " AS VARCHAR)" : pk;
      String sql = "SELECT * FROM " + source
          + " WHERE " + column + " IN (" + JdbcTemplate.placeholders(keys.size()) + ")";
      JdbcTemplate.query(conn, sql, rs -> rows.put(rs.getString(pk), readRow(rs)), keys.toArray());
    }
    return rows;
  }

  static KeyType keyType(Connection conn, String source, String pk) {
    String sql = "SELECT " + pk + " FROM " + source + " WHERE 1 = 0";
    try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
      ResultSetMetaData meta = rs.getMetaData();
      return KeyType.of(meta.getColumnType(1), meta.getColumnTypeName(1));
    } catch (SQLException e) {
      throw new ChangeQueueException("Failed to read primary key type of " + source, e);
    }
  }

  /** How record ids are bound against a primary key column. */
  enum KeyType {
    INTEGER {
      @Override
      Object parse(String id) {
        try {
          return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
          return null;
        }
      }
    },
    DECIMAL {
      @Override
      Object parse(String id) {
        try {
          return new BigDecimal(id.trim());
        } catch (NumberFormatException e) {
          return null;
        }
      }
    },
    UUID {
      @Override
      Object parse(String id) {
        try {
          return java.util.UUID.fromString(id.trim());
        } catch (IllegalArgumentException e) {
          return null;
        }
      }
    },
    CHARACTER {
      @Override
      Object parse(String id) {
        return id;
      }
    },
    /** Compared as text on the column side; cannot use the key's index. */
    TEXT {
      @Override
      Object parse(String id) {
        return id;
      }
    };

    abstract Object parse(String id);

    static KeyType of(int sqlType, String typeName) {
      if ("uuid".equalsIgnoreCase(typeName)) {
        return UUID;
      }
      switch (sqlType) {
        case Types.TINYINT:
        case Types.SMALLINT:
        case Types.INTEGER:
        case Types.BIGINT:
          return INTEGER;
        case Types.NUMERIC:
        case Types.DECIMAL:
          return DECIMAL;
        case Types.CHAR:
        case Types.VARCHAR:
        case Types.LONGVARCHAR:
        case Types.NCHAR:
        case Types.NVARCHAR:
        case Types.LONGNVARCHAR:
          return CHARACTER;
        default:
          return TEXT;
      }
    }
  }

  @Override
  public long count(Connection conn, TableMapping table) {
    String source = TableNames.validateQualified(table.name());
    return JdbcTemplate.queryForObject(conn, "SELECT COUNT(*) FROM " + source, rs -> rs.getLong(1));
  }

  static Map<String, Object> readRow(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      row.put(meta.getColumnLabel(i), readValue(rs, meta, i));
    }
    return row;
  }

  private static Object readValue(ResultSet rs, ResultSetMetaData meta, int column) throws SQLException {
    switch (meta.getColumnType(column)) {
      case Types.TIMESTAMP_WITH_TIMEZONE:
        return rs.getObject(column, OffsetDateTime.class);
      case Types.TIMESTAMP:
        return "timestamptz".equalsIgnoreCase(meta.getColumnTypeName(column))
            ? rs.getObject(column, OffsetDateTime.class)
            : rs.getObject(column, LocalDateTime.class);
      case Types.DATE:
        return rs.getObject(column, LocalDate.class);
      case Types.TIME:
        return rs.getObject(column, LocalTime.class);
      case Types.ARRAY:
        Array array = rs.getArray(column);
        if (array == null) {
          return null;
        }
        try {
          return Arrays.asList((Object[]) array.getArray());
        } finally {
          array.free();
        }
      case Types.CLOB:
      case Types.NCLOB:
        return rs.getString(column);
      default:
        Object value = rs.getObject(column);
        if (value != null && !value.getClass().getName().startsWith("java.")) {
          return rs.getString(column);
        }
        return value;
    }
  }
}
