package pgsync.typesense;

import org.junit.jupiter.api.Test;
import pgsync.mapping.FieldSpec;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionSchemasTest {

  @Test
  void resolvedDefaultsAreAlwaysSent() {
    Map<String, Object> field = CollectionSchemas.fieldOf(FieldSpec.builder("meta").type("object").build());

    assertEquals("object", field.get("type"));
    assertEquals(true, field.get("optional"));
    assertEquals(false, field.get("facet"));
    assertEquals(false, field.get("index"));
    assertEquals(false, field.get("sort"));
    assertFalse(field.containsKey("stem"));
    assertFalse(field.containsKey("store"));
    assertFalse(field.containsKey("embed"));
  }

  @Test
  void explicitAttributesArePassedThrough() {
    Map<String, Object> field = CollectionSchemas.fieldOf(FieldSpec.builder("embedding")
        .type("float[]")
        .numDim(384)
        .embed(Map.of("from", List.of("name")))
        .stem(false)
        .store(true)
        .build());

    assertEquals(384, field.get("num_dim"));
    assertEquals(false, field.get("stem"));
    assertEquals(true, field.get("store"));
    assertEquals(Map.of("from", List.of("name")), field.get("embed"));
  }

  @Test
  void emptyLocaleIsOmitted() {
    Map<String, Object> field = CollectionSchemas.fieldOf(FieldSpec.builder("name").type("string").locale("").build());
    assertFalse(field.containsKey("locale"));
  }
}
