package pgsync.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized, index-ready document: an insertion-ordered map from field name to
 * {@link DocValue}.
 */
public final class Document {
    private final Map<String, DocValue> fields;

    public Document(Map<String, DocValue> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, DocValue> fields() {
        return fields;
    }

    public DocValue get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Document id as sent to the index: the {@code id} field rendered as text, or
     * {@code null} when absent.
     */
    public String id() {
        DocValue id = fields.get("id");
        if (id == null || id instanceof DocValue.Null) {
            return null;
        }
        if (id instanceof DocValue.Str s) {
            return s.value();
        }
        return String.valueOf(id.toJava());
    }

    /**
     * Plain-Java view of the document, suitable for JSON serialization.
     */
    public Map<String, Object> toJava() {
        Map<String, Object> out = new LinkedHashMap<>();
        fields.forEach((key, value) -> out.put(key, value.toJava()));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Document other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + toJava();
    }
}
