package pgsync.typesense;

import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link TableMapping} as a Typesense collection schema.
 *
 * <p>{@code optional}, {@code facet}, {@code index} and {@code sort} are always sent
 * with their resolved defaults. The other field attributes and the collection-level
 * settings are sent only when configured.
 */
final class CollectionSchemas {

  private CollectionSchemas() {}

  static Map<String, Object> schemaOf(TableMapping table) {
    List<Map<String, Object>> fields = new ArrayList<>();
    for (FieldSpec field : table.schema()) {
      fields.add(fieldOf(field));
    }
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("name", table.collection());
    schema.put("fields", fields);
    putIfSet(schema, "default_sorting_field", table.defaultSortingField());
    putIfSet(schema, "token_separators", table.tokenSeparators());
    putIfSet(schema, "symbols_to_index", table.symbolsToIndex());
    return schema;
  }

  static Map<String, Object> fieldOf(FieldSpec field) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("name", field.name());
    out.put("type", field.type().wireName());
    out.put("optional", field.optional());
    out.put("facet", field.facet());
    out.put("index", field.index());
    out.put("sort", field.sort());
    putIfSet(out, "infix", field.infix());
    if (field.locale() != null && !field.locale().isEmpty()) {
      out.put("locale", field.locale());
    }
    putIfSet(out, "stem", field.stem());
    putIfSet(out, "store", field.store());
    putIfSet(out, "embed", field.embed());
    putIfSet(out, "num_dim", field.numDim());
    return out;
  }

  private static void putIfSet(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }
}
