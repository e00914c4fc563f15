package pgsync.mapping;

/**
 * Richer source representation a field was declared with before being mapped to
 * its stored {@link FieldType}. Drives the pipeline's type conversion.
 */
public enum SourceType {
  /** Stored as {@link FieldType#INT64} epoch seconds. */
  DATE("date", FieldType.INT64),
  /** Stored as {@link FieldType#FLOAT_ARRAY}; requires {@code num_dim}. */
  VECTOR("vector", FieldType.FLOAT_ARRAY);

  private final String configName;
  private final FieldType storedAs;

  SourceType(String configName, FieldType storedAs) {
    this.configName = configName;
    this.storedAs = storedAs;
  }

  public String configName() {
    return configName;
  }

  public FieldType storedAs() {
    return storedAs;
  }

  static SourceType fromConfigName(String name) {
    for (SourceType type : values()) {
      if (type.configName.equals(name)) {
        return type;
      }
    }
    return null;
  }
}
