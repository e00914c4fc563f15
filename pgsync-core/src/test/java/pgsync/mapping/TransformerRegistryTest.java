package pgsync.mapping;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransformerRegistryTest {

  @Test
  void emptyNameResolvesToIdentity() {
    TransformerRegistry registry = new TransformerRegistry();

    assertSame(RowTransformer.IDENTITY, registry.resolve(null));
    assertSame(RowTransformer.IDENTITY, registry.resolve(""));
  }

  @Test
  void unknownNameFailsFastWithRegisteredNames() {
    TransformerRegistry registry = new TransformerRegistry().register("transform_product", row -> row);

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.resolve("nope"));
    assertTrue(e.getMessage().contains("transform_product"));
  }

  @Test
  void rejectsConflictingRegistration() {
    RowTransformer first = row -> row;
    TransformerRegistry registry = new TransformerRegistry().register("t", first);

    registry.register("t", first);
    assertThrows(IllegalStateException.class, () -> registry.register("t", row -> row));
    assertEquals(Set.of("t"), registry.names());
  }
}
