package pgsync.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void validNamesAreReturned() {
    assertEquals("typesense_sync_queue", TableNames.validate("typesense_sync_queue"));
    assertEquals("Products2", TableNames.validate("Products2"));
    assertEquals("_tmp", TableNames.validate("_tmp"));
  }

  @Test
  void defaultQueueTable() {
    assertEquals("typesense_sync_queue", TableNames.DEFAULT_QUEUE_TABLE);
  }

  @Test
  void invalidNamesAreRejected() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("products; DROP TABLE users"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("public.products"));
  }

  @Test
  void qualifiedNamesAllowOneSchemaPrefix() {
    assertEquals("public.products", TableNames.validateQualified("public.products"));
    assertEquals("products", TableNames.validateQualified("products"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validateQualified("a.b.c"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validateQualified("public."));
  }

  @Test
  void unqualifiedStripsSchema() {
    assertEquals("products", TableNames.unqualified("public.products"));
    assertEquals("products", TableNames.unqualified("products"));
  }
}
