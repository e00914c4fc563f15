package pgsync.demo;

import pgsync.mapping.TableMappingRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows the configured tables to a {@code --tables=a,b} selection.
 */
final class TableSelection {

  private TableSelection() {}

  /**
   * @param option comma-separated table names; {@code null} or blank selects every table
   * @throws IllegalArgumentException if none of the requested names is configured
   */
  static TableMappingRegistry select(TableMappingRegistry tables, String option) {
    List<String> requested = parse(option);
    if (requested.isEmpty()) {
      return tables;
    }
    TableMappingRegistry selected = tables.select(requested);
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("No matching tables found for: " + String.join(", ", requested)
          + ". Available tables: " + String.join(", ", tables.names()));
    }
    return selected;
  }

  static List<String> parse(String option) {
    List<String> names = new ArrayList<>();
    if (option == null) {
      return names;
    }
    for (String part : option.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    return names;
  }
}
