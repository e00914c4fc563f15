package pgsync.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationTypeTest {

  @Test
  void parsesTriggerCodes() {
    assertEquals(OperationType.INSERT, OperationType.fromCode("INSERT"));
    assertEquals(OperationType.UPDATE, OperationType.fromCode(" update "));
    assertEquals(OperationType.DELETE, OperationType.fromCode("DELETE"));
  }

  @Test
  void onlyDeleteIsNotAnUpsert() {
    assertTrue(OperationType.INSERT.isUpsert());
    assertTrue(OperationType.UPDATE.isUpsert());
    assertFalse(OperationType.DELETE.isUpsert());
  }

  @Test
  void rejectsUnknownCodes() {
    assertThrows(IllegalArgumentException.class, () -> OperationType.fromCode("TRUNCATE"));
    assertThrows(IllegalArgumentException.class, () -> OperationType.fromCode(null));
  }
}
