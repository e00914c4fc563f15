package pgsync.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validated, read-only set of {@link TableMapping}s for one run, keyed by table name.
 */
public final class TableMappingRegistry {
  private final Map<String, TableMapping> mappings;

  private TableMappingRegistry(Map<String, TableMapping> mappings) {
    this.mappings = Collections.unmodifiableMap(mappings);
  }

  /**
   * @throws IllegalArgumentException if two mappings share a name
   */
  public static TableMappingRegistry of(Collection<TableMapping> tables) {
    Objects.requireNonNull(tables, "tables");
    Map<String, TableMapping> byName = new LinkedHashMap<>();
    for (TableMapping table : tables) {
      if (byName.put(table.name(), table) != null) {
        throw new IllegalArgumentException("Duplicate table mapping: " + table.name());
      }
    }
    return new TableMappingRegistry(byName);
  }

  public static TableMappingRegistry of(TableMapping... tables) {
    return of(List.of(tables));
  }

  /** Returns the mapping for {@code tableName}, or {@code null} if it is not tracked. */
  public TableMapping get(String tableName) {
    return mappings.get(tableName);
  }

  public boolean contains(String tableName) {
    return mappings.containsKey(tableName);
  }

  /** Table names in configuration order. */
  public Set<String> names() {
    return mappings.keySet();
  }

  public Collection<TableMapping> all() {
    return mappings.values();
  }

  public boolean isEmpty() {
    return mappings.isEmpty();
  }

  public int size() {
    return mappings.size();
  }

  /**
   * Narrows the registry to the requested table names, keeping configuration order.
   * A {@code null} or empty request keeps every table; names that are not tracked
   * are ignored.
   */
  public TableMappingRegistry select(Collection<String> tableNames) {
    if (tableNames == null || tableNames.isEmpty()) {
      return this;
    }
    List<TableMapping> selected = new ArrayList<>();
    for (TableMapping table : mappings.values()) {
      if (tableNames.contains(table.name())) {
        selected.add(table);
      }
    }
    return of(selected);
  }
}
