package pgsync.mapping;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Field types accepted by the target collection schema, keyed by their wire name.
 *
 * <p>The configuration-only types {@code date} and {@code vector} are not listed
 * here: {@link FieldSpec.Builder#type(String)} rewrites them to {@link #INT64} and
 * {@link #FLOAT_ARRAY} and records the original in {@link SourceType}.
 */
public enum FieldType {
  STRING("string"),
  INT32("int32"),
  INT64("int64"),
  FLOAT("float"),
  BOOL("bool"),
  GEOPOINT("geopoint"),
  GEOPOINT_ARRAY("geopoint[]"),
  STRING_ARRAY("string[]"),
  INT32_ARRAY("int32[]"),
  INT64_ARRAY("int64[]"),
  FLOAT_ARRAY("float[]"),
  BOOL_ARRAY("bool[]"),
  OBJECT("object"),
  OBJECT_ARRAY("object[]"),
  AUTO("auto"),
  STRING_AUTO("string*");

  private final String wireName;

  FieldType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean isObject() {
    return this == OBJECT || this == OBJECT_ARRAY;
  }

  /**
   * @throws IllegalArgumentException if {@code name} is not a known wire name
   */
  public static FieldType fromWireName(String name) {
    for (FieldType type : values()) {
      if (type.wireName.equals(name)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid field type '" + name + "'. Valid types: " + validNames());
  }

  static String validNames() {
    return Arrays.stream(values()).map(FieldType::wireName).collect(Collectors.joining(", "))
        + ", " + SourceType.DATE.configName() + ", " + SourceType.VECTOR.configName();
  }
}
