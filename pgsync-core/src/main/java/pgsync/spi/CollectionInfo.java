package pgsync.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An existing collection as reported by the index.
 *
 * @param name         collection name
 * @param numDocuments number of indexed documents
 * @param fieldTypes   declared field types by field name, in schema order
 */
public record CollectionInfo(String name, long numDocuments, Map<String, String> fieldTypes) {

    public CollectionInfo {
        Objects.requireNonNull(name, "name");
        fieldTypes = fieldTypes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }
}
