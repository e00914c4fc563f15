package pgsync.sync;

import pgsync.mapping.TableMapping;
import pgsync.spi.RowFetcher;

import java.sql.Connection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RowFetcher stub serving rows from a map of table name to id to row.
 */
class StubRowFetcher implements RowFetcher {
  final Map<String, Map<String, Map<String, Object>>> rows = new HashMap<>();
  RuntimeException failure;

  StubRowFetcher put(String table, String id, Map<String, Object> row) {
    rows.computeIfAbsent(table, k -> new HashMap<>()).put(id, row);
    return this;
  }

  @Override
  public Map<String, Map<String, Object>> fetch(Connection conn, TableMapping table, List<String> recordIds) {
    if (failure != null) {
      throw failure;
    }
    Map<String, Map<String, Object>> found = new LinkedHashMap<>();
    Map<String, Map<String, Object>> tableRows = rows.getOrDefault(table.name(), Map.of());
    for (String id : recordIds) {
      if (tableRows.containsKey(id)) {
        found.put(id, new LinkedHashMap<>(tableRows.get(id)));
      }
    }
    return found;
  }

  @Override
  public long count(Connection conn, TableMapping table) {
    return rows.getOrDefault(table.name(), Map.of()).size();
  }
}
