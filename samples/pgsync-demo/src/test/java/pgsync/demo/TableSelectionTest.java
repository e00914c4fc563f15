package pgsync.demo;

import org.junit.jupiter.api.Test;
import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableSelectionTest {

  private final TableMappingRegistry tables = TableMappingRegistry.of(table("products"), table("users"));

  @Test
  void noOptionSelectsEverything() {
    assertSame(tables, TableSelection.select(tables, null));
    assertSame(tables, TableSelection.select(tables, " , "));
  }

  @Test
  void selectsRequestedTablesInConfigurationOrder() {
    TableMappingRegistry selected = TableSelection.select(tables, "users, products");
    assertEquals(List.of("products", "users"), new ArrayList<>(selected.names()));
  }

  @Test
  void ignoresUnknownNamesWhenOthersMatch() {
    TableMappingRegistry selected = TableSelection.select(tables, "users,orders");
    assertEquals(List.of("users"), new ArrayList<>(selected.names()));
  }

  @Test
  void emptySelectionListsAvailableTables() {
    var e = assertThrows(IllegalArgumentException.class, () -> TableSelection.select(tables, "orders"));
    assertEquals("No matching tables found for: orders. Available tables: products, users", e.getMessage());
  }

  private static TableMapping table(String name) {
    return TableMapping.builder(name)
        .collection(name)
        .field(FieldSpec.builder("id").type("string").build())
        .build();
  }
}
