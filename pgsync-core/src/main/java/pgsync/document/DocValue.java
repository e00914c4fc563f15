package pgsync.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged value stored in a {@link Document}.
 *
 * <p>The variants are exactly what a search document can carry. Conversion from
 * arbitrary JDBC/Java values happens in {@link pgsync.transform.ValueNormalizer};
 * once a value is a {@code DocValue} it is already in wire shape.
 */
public sealed interface DocValue
    permits DocValue.Null, DocValue.Bool, DocValue.Int, DocValue.Float, DocValue.Str, DocValue.Array, DocValue.Obj {

    Null NULL = new Null();

    static DocValue of(boolean value) {
        return new Bool(value);
    }

    static DocValue of(long value) {
        return new Int(value);
    }

    static DocValue of(double value) {
        return new Float(value);
    }

    static DocValue of(String value) {
        return value == null ? NULL : new Str(value);
    }

    static DocValue floats(List<Double> values) {
        List<DocValue> items = new ArrayList<>(values.size());
        for (Double value : values) {
            items.add(new Float(value));
        }
        return new Array(items);
    }

    /**
     * Converts back to plain Java values ({@code null}, {@link Boolean}, {@link Long},
     * {@link Double}, {@link String}, {@link List}, {@link Map}) for serializers.
     */
    Object toJava();

    record Null() implements DocValue {
        @Override
        public Object toJava() {
            return null;
        }
    }

    record Bool(boolean value) implements DocValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record Int(long value) implements DocValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record Float(double value) implements DocValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record Str(String value) implements DocValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record Array(List<DocValue> items) implements DocValue {
        public Array {
            items = List.copyOf(items);
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(items.size());
            for (DocValue item : items) {
                out.add(item.toJava());
            }
            return Collections.unmodifiableList(out);
        }
    }

    record Obj(Map<String, DocValue> fields) implements DocValue {
        public Obj {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Object toJava() {
            Map<String, Object> out = new LinkedHashMap<>();
            fields.forEach((key, value) -> out.put(key, value.toJava()));
            return Collections.unmodifiableMap(out);
        }
    }
}
