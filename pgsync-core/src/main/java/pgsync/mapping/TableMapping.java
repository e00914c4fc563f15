package pgsync.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Links one tracked source (table or view) to one target collection.
 *
 * <p>When {@link #referenceTable()} is set, {@link #name()} is a view: the trigger is
 * installed on the reference table but enqueues entries under the view's name, and
 * rows are fetched from the view.
 *
 * <p>Immutable once built.
 */
public final class TableMapping {
  private final String name;
  private final String collection;
  private final List<FieldSpec> schema;
  private final Map<String, FieldSpec> fieldsByName;
  private final Map<String, String> columnMapping;
  private final Map<String, String> reverseColumnMapping;
  private final RowTransformer transformer;
  private final String transformerName;
  private final String referenceTable;
  private final String primaryKey;
  private final String defaultSortingField;
  private final List<String> tokenSeparators;
  private final List<String> symbolsToIndex;

  private TableMapping(Builder builder) {
    this.name = builder.name;
    this.collection = builder.collection;
    this.schema = List.copyOf(builder.schema);
    Map<String, FieldSpec> byName = new LinkedHashMap<>();
    Map<String, String> mapping = new LinkedHashMap<>();
    Map<String, String> reverse = new LinkedHashMap<>();
    for (FieldSpec field : schema) {
      if (byName.put(field.name(), field) != null) {
        throw new IllegalArgumentException("Table '" + name + "': duplicate field '" + field.name() + "'");
      }
      mapping.put(field.name(), field.sourceColumn());
      reverse.put(field.sourceColumn(), field.name());
    }
    this.fieldsByName = Collections.unmodifiableMap(byName);
    this.columnMapping = Collections.unmodifiableMap(mapping);
    this.reverseColumnMapping = Collections.unmodifiableMap(reverse);
    this.transformer = builder.transformer != null ? builder.transformer : RowTransformer.IDENTITY;
    this.transformerName = builder.transformerName;
    this.referenceTable = builder.referenceTable;
    this.primaryKey = builder.primaryKey;
    this.defaultSortingField = builder.defaultSortingField;
    this.tokenSeparators = builder.tokenSeparators == null ? null : List.copyOf(builder.tokenSeparators);
    this.symbolsToIndex = builder.symbolsToIndex == null ? null : List.copyOf(builder.symbolsToIndex);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Logical source name; also the {@code table_name} written to the queue. */
  public String name() {
    return name;
  }

  /** Target collection name. */
  public String collection() {
    return collection;
  }

  public List<FieldSpec> schema() {
    return schema;
  }

  public FieldSpec field(String fieldName) {
    return fieldsByName.get(fieldName);
  }

  public Set<String> fieldNames() {
    return fieldsByName.keySet();
  }

  /** Target field name → source column name. */
  public Map<String, String> columnMapping() {
    return columnMapping;
  }

  /** Source column name → target field name. */
  public Map<String, String> reverseColumnMapping() {
    return reverseColumnMapping;
  }

  public RowTransformer transformer() {
    return transformer;
  }

  /** Registry identifier of the transformer, {@code null} for identity. */
  public String transformerName() {
    return transformerName;
  }

  /** Physical table the trigger is attached to when {@link #name()} is a view; otherwise {@code null}. */
  public String referenceTable() {
    return referenceTable;
  }

  public boolean isViewBacked() {
    return referenceTable != null;
  }

  /** Primary key column used to fetch rows and render record ids. */
  public String primaryKey() {
    return primaryKey;
  }

  public String defaultSortingField() {
    return defaultSortingField;
  }

  public List<String> tokenSeparators() {
    return tokenSeparators;
  }

  public List<String> symbolsToIndex() {
    return symbolsToIndex;
  }

  @Override
  public String toString() {
    return "TableMapping{" + name + " -> " + collection + (referenceTable != null ? " via " + referenceTable : "") + "}";
  }

  public static final class Builder {
    private final String name;
    private String collection;
    private final List<FieldSpec> schema = new ArrayList<>();
    private RowTransformer transformer;
    private String transformerName;
    private String referenceTable;
    private String primaryKey = "id";
    private String defaultSortingField;
    private List<String> tokenSeparators;
    private List<String> symbolsToIndex;

    private Builder(String name) {
      this.name = name;
    }

    public Builder collection(String collection) {
      this.collection = collection;
      return this;
    }

    public Builder field(FieldSpec field) {
      schema.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder schema(List<FieldSpec> fields) {
      fields.forEach(this::field);
      return this;
    }

    public Builder transformer(RowTransformer transformer) {
      this.transformer = transformer;
      return this;
    }

    /**
     * Resolves {@code transformerName} against {@code registry} immediately.
     *
     * @throws IllegalArgumentException if the name is not registered
     */
    public Builder transformer(String transformerName, TransformerRegistry registry) {
      this.transformer = registry.resolve(transformerName);
      this.transformerName = transformerName == null || transformerName.isEmpty() ? null : transformerName;
      return this;
    }

    public Builder referenceTable(String referenceTable) {
      this.referenceTable = referenceTable;
      return this;
    }

    public Builder primaryKey(String primaryKey) {
      this.primaryKey = primaryKey;
      return this;
    }

    public Builder defaultSortingField(String defaultSortingField) {
      this.defaultSortingField = defaultSortingField;
      return this;
    }

    public Builder tokenSeparators(List<String> tokenSeparators) {
      this.tokenSeparators = tokenSeparators;
      return this;
    }

    public Builder symbolsToIndex(List<String> symbolsToIndex) {
      this.symbolsToIndex = symbolsToIndex;
      return this;
    }

    /**
     * @throws IllegalArgumentException if name, collection or primary key is blank,
     *                                  a reference table is blank, or field names repeat
     */
    public TableMapping build() {
      requireText(name, "name");
      requireText(collection, "Table '" + name + "': collection");
      requireText(primaryKey, "Table '" + name + "': primaryKey");
      if (referenceTable != null && referenceTable.isBlank()) {
        throw new IllegalArgumentException("Table '" + name + "': 'reference_table' must be a non-empty string");
      }
      Set<String> columns = new LinkedHashSet<>();
      for (FieldSpec field : schema) {
        if (!columns.add(field.sourceColumn())) {
          throw new IllegalArgumentException("Table '" + name + "': source column '"
              + field.sourceColumn() + "' is mapped by more than one field");
        }
      }
      return new TableMapping(this);
    }

    private static void requireText(String value, String what) {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException(what + " must not be empty");
      }
    }
  }
}
