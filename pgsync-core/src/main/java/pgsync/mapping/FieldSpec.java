package pgsync.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One field of a target collection schema.
 *
 * <p>Only {@link #type()} and {@link #sourceType()} influence document
 * normalization. The remaining flags are passed through to collection
 * provisioning. Instances are built with all defaults resolved:
 * <ul>
 *   <li>{@code optional} is {@code false} for a field named {@code id}, {@code true} otherwise</li>
 *   <li>{@code facet} and {@code sort} are {@code false}</li>
 *   <li>{@code index} is {@code true} except for {@code object} and {@code object[]}</li>
 * </ul>
 * {@code infix}, {@code stem}, {@code store}, {@code locale}, {@code numDim} and
 * {@code embed} stay {@code null} unless configured.
 */
public final class FieldSpec {
  private final String name;
  private final String sourceColumn;
  private final FieldType type;
  private final SourceType sourceType;
  private final boolean optional;
  private final boolean facet;
  private final boolean index;
  private final boolean sort;
  private final Boolean infix;
  private final Boolean stem;
  private final Boolean store;
  private final String locale;
  private final Integer numDim;
  private final Map<String, Object> embed;

  private FieldSpec(Builder builder, FieldType type, SourceType sourceType) {
    this.name = builder.name;
    this.sourceColumn = builder.sourceColumn != null ? builder.sourceColumn : builder.name;
    this.type = type;
    this.sourceType = sourceType;
    this.optional = builder.optional != null ? builder.optional : !"id".equals(builder.name);
    this.facet = builder.facet != null && builder.facet;
    this.index = builder.index != null ? builder.index : !type.isObject();
    this.sort = builder.sort != null && builder.sort;
    this.infix = builder.infix;
    this.stem = builder.stem;
    this.store = builder.store;
    this.locale = builder.locale;
    this.numDim = builder.numDim;
    this.embed = builder.embed == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.embed));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Target field name. */
  public String name() {
    return name;
  }

  /** Source column name; equals {@link #name()} unless aliased. */
  public String sourceColumn() {
    return sourceColumn;
  }

  public FieldType type() {
    return type;
  }

  /** {@code null} when the field was declared with a plain collection type. */
  public SourceType sourceType() {
    return sourceType;
  }

  public boolean optional() {
    return optional;
  }

  public boolean facet() {
    return facet;
  }

  public boolean index() {
    return index;
  }

  public boolean sort() {
    return sort;
  }

  public Boolean infix() {
    return infix;
  }

  public Boolean stem() {
    return stem;
  }

  public Boolean store() {
    return store;
  }

  public String locale() {
    return locale;
  }

  public Integer numDim() {
    return numDim;
  }

  public Map<String, Object> embed() {
    return embed;
  }

  @Override
  public String toString() {
    return name + ":" + type.wireName() + (sourceType != null ? "(" + sourceType.configName() + ")" : "");
  }

  public static final class Builder {
    private final String name;
    private String declaredType;
    private String sourceColumn;
    private Boolean optional;
    private Boolean facet;
    private Boolean index;
    private Boolean sort;
    private Boolean infix;
    private Boolean stem;
    private Boolean store;
    private String locale;
    private Integer numDim;
    private Map<String, Object> embed;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Declared type: any {@link FieldType} wire name, or {@code date} / {@code vector}.
     */
    public Builder type(String declaredType) {
      this.declaredType = declaredType;
      return this;
    }

    public Builder type(FieldType type) {
      return type(type.wireName());
    }

    /**
     * Source column this field reads from, when it differs from the field name.
     */
    public Builder sourceColumn(String sourceColumn) {
      this.sourceColumn = sourceColumn;
      return this;
    }

    public Builder optional(Boolean optional) {
      this.optional = optional;
      return this;
    }

    public Builder facet(Boolean facet) {
      this.facet = facet;
      return this;
    }

    public Builder index(Boolean index) {
      this.index = index;
      return this;
    }

    public Builder sort(Boolean sort) {
      this.sort = sort;
      return this;
    }

    public Builder infix(Boolean infix) {
      this.infix = infix;
      return this;
    }

    public Builder stem(Boolean stem) {
      this.stem = stem;
      return this;
    }

    public Builder store(Boolean store) {
      this.store = store;
      return this;
    }

    public Builder locale(String locale) {
      this.locale = locale;
      return this;
    }

    public Builder numDim(Integer numDim) {
      this.numDim = numDim;
      return this;
    }

    /**
     * Auto-embedding configuration; must contain a {@code from} entry.
     */
    public Builder embed(Map<String, Object> embed) {
      this.embed = embed;
      return this;
    }

    /**
     * @throws NullPointerException     if name or type is missing
     * @throws IllegalArgumentException if the type is unknown, a vector lacks
     *                                  {@code numDim}, or {@code embed} lacks {@code from}
     */
    public FieldSpec build() {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Field name must not be blank");
      }
      Objects.requireNonNull(declaredType, "type of field '" + name + "'");
      SourceType sourceType = SourceType.fromConfigName(declaredType);
      FieldType type;
      try {
        type = sourceType != null ? sourceType.storedAs() : FieldType.fromWireName(declaredType);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Field '" + name + "': invalid type '" + declaredType
            + "'. Valid types: " + FieldType.validNames(), e);
      }
      if (sourceType == SourceType.VECTOR && numDim == null) {
        throw new IllegalArgumentException("Field '" + name + "': 'num_dim' is required for vector fields");
      }
      if (numDim != null && numDim <= 0) {
        throw new IllegalArgumentException("Field '" + name + "': 'num_dim' must be > 0");
      }
      if (embed != null && !embed.containsKey("from")) {
        throw new IllegalArgumentException("Field '" + name + "': 'embed.from' is required for embedding fields");
      }
      return new FieldSpec(this, type, sourceType);
    }
  }
}
