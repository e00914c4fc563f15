package pgsync.spring.boot;

import pgsync.mapping.FieldSpec;
import pgsync.mapping.TableMapping;
import pgsync.mapping.TableMappingRegistry;
import pgsync.mapping.TransformerRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the {@code pgsync.tables} properties and builds the mapping registry.
 *
 * <p>Errors name the offending table and field by position, for example
 * {@code Table 2, schema field 3 ('embedding'): 'num_dim' is required for vector fields}.
 */
final class TableMappings {

  private TableMappings() {}

  /**
   * @throws IllegalStateException if the configuration is invalid or names an unknown transformer
   */
  static TableMappingRegistry build(List<PgSyncProperties.Table> tables, TransformerRegistry transformers) {
    if (tables == null || tables.isEmpty()) {
      throw new IllegalStateException("No tables defined in the configuration (pgsync.tables)");
    }
    List<TableMapping> mappings = new ArrayList<>();
    for (int i = 0; i < tables.size(); i++) {
      mappings.add(table(i + 1, tables.get(i), transformers));
    }
    try {
      return TableMappingRegistry.of(mappings);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  private static TableMapping table(int position, PgSyncProperties.Table table, TransformerRegistry transformers) {
    String prefix = "Table " + position;
    if (isBlank(table.getName()) || isBlank(table.getCollection()) || table.getSchema() == null) {
      throw new IllegalStateException(prefix + " must have 'name', 'collection', and 'schema' fields.");
    }
    if (table.getReferenceTable() != null && table.getReferenceTable().isBlank()) {
      throw new IllegalStateException(prefix + " 'reference_table' must be a non-empty string.");
    }
    TableMapping.Builder builder = TableMapping.builder(table.getName())
        .collection(table.getCollection())
        .referenceTable(table.getReferenceTable())
        .primaryKey(table.getPrimaryKey())
        .defaultSortingField(table.getDefaultSortingField())
        .tokenSeparators(table.getTokenSeparators())
        .symbolsToIndex(table.getSymbolsToIndex());

    List<PgSyncProperties.Field> schema = table.getSchema();
    for (int j = 0; j < schema.size(); j++) {
      builder.field(field(prefix + ", schema field " + (j + 1), schema.get(j)));
    }
    try {
      builder.transformer(table.getTransformer(), transformers);
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(prefix + " ('" + table.getName() + "'): " + e.getMessage(), e);
    }
  }

  private static FieldSpec field(String prefix, PgSyncProperties.Field field) {
    if (isBlank(field.getName()) || isBlank(field.getType())) {
      throw new IllegalStateException(prefix + " must have 'name' and 'type'.");
    }
    try {
      return FieldSpec.builder(field.getName())
          .type(field.getType())
          .sourceColumn(field.getSourceColumn())
          .optional(field.getOptional())
          .facet(field.getFacet())
          .index(field.getIndex())
          .sort(field.getSort())
          .infix(field.getInfix())
          .stem(field.getStem())
          .store(field.getStore())
          .locale(field.getLocale())
          .numDim(field.getNumDim())
          .embed(field.getEmbed())
          .build();
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(prefix + " ('" + field.getName() + "'): " + e.getMessage(), e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
