package pgsync.transform;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import pgsync.document.DocValue;
import pgsync.document.Document;
import pgsync.mapping.FieldSpec;
import pgsync.mapping.FieldType;
import pgsync.mapping.SourceType;
import pgsync.mapping.TableMapping;

/**
 * Turns a raw source row into a schema-conforming {@link Document}.
 *
 * <p>Steps run in a fixed order:
 * <ol>
 *   <li>the table's {@link pgsync.mapping.RowTransformer} (on a copy of the row)</li>
 *   <li>column aliasing: source column names are replaced by schema field names</li>
 *   <li>pruning: keys that are not schema fields are dropped</li>
 *   <li>normalization: {@code date} fields become epoch seconds, {@code vector} fields
 *       become float arrays, everything else goes through {@link ValueNormalizer}</li>
 * </ol>
 *
 * <p>A field whose date or vector conversion fails is set to null and logged. A
 * transformer failure, or any other conversion error, rejects the whole row.
 * Decimals stay exact text unless the field is a {@code float}.
 */
public final class DocumentPipeline {
    private static final Logger logger = Logger.getLogger(DocumentPipeline.class.getName());

    private final DateConverter dates;
    private final VectorConverter vectors;
    private final ValueNormalizer values;

    /** Naive timestamps are read as UTC. */
    public DocumentPipeline() {
        this(ZoneOffset.UTC);
    }

    public DocumentPipeline(ZoneId zone) {
        this.dates = new DateConverter(zone);
        this.vectors = new VectorConverter();
        this.values = new ValueNormalizer(dates);
    }

    public ZoneId zone() {
        return dates.zone();
    }

    public Document normalize(Map<String, Object> row, TableMapping mapping) throws TransformException {
        Objects.requireNonNull(row, "row");
        Objects.requireNonNull(mapping, "mapping");

        Map<String, Object> transformed;
        try {
            transformed = mapping.transformer().transform(new LinkedHashMap<>(row));
        } catch (RuntimeException e) {
            throw new TransformException(mapping.name(),
                "Transformer failed for table '" + mapping.name() + "': " + e.getMessage(), e);
        }
        if (transformed == null) {
            throw new TransformException(mapping.name(),
                "Transformer returned no row for table '" + mapping.name() + "'", null);
        }

        Map<String, Object> pruned = pruneToSchema(
            applyColumnAliases(transformed, mapping.reverseColumnMapping()), mapping.fieldNames());

        Map<String, DocValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : pruned.entrySet()) {
            FieldSpec field = mapping.field(entry.getKey());
            try {
                fields.put(entry.getKey(), convert(mapping, field, entry.getValue()));
            } catch (RuntimeException e) {
                throw new TransformException(mapping.name(), "Failed to convert field '" + entry.getKey()
                    + "' of table '" + mapping.name() + "': " + e, e);
            }
        }
        return new Document(fields);
    }

    /**
     * Renames keys found in {@code reverseMapping} (source column → field name); other
     * keys keep their name. Later keys win on collision.
     */
    static Map<String, Object> applyColumnAliases(Map<String, Object> row, Map<String, String> reverseMapping) {
        Map<String, Object> aliased = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            aliased.put(reverseMapping.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        }
        return aliased;
    }

    static Map<String, Object> pruneToSchema(Map<String, Object> row, Set<String> fieldNames) {
        Map<String, Object> pruned = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (fieldNames.contains(entry.getKey())) {
                pruned.put(entry.getKey(), entry.getValue());
            }
        }
        return pruned;
    }

    private DocValue convert(TableMapping mapping, FieldSpec field, Object value) {
        SourceType sourceType = field.sourceType();
        if (sourceType == SourceType.DATE) {
            try {
                Long seconds = dates.toEpochSeconds(value);
                return seconds == null ? DocValue.NULL : DocValue.of(seconds.longValue());
            } catch (IllegalArgumentException e) {
                logger.log(Level.WARNING, "Failed to convert date field ''{0}'' of table ''{1}'': {2}",
                    new Object[] {field.name(), mapping.name(), e.getMessage()});
                return DocValue.NULL;
            }
        }
        if (sourceType == SourceType.VECTOR) {
            try {
                List<Double> vector = vectors.toFloats(value);
                return vector == null ? DocValue.NULL : DocValue.floats(vector);
            } catch (IllegalArgumentException e) {
                logger.log(Level.WARNING, "Failed to convert vector field ''{0}'' of table ''{1}'': {2}",
                    new Object[] {field.name(), mapping.name(), e.getMessage()});
                return DocValue.NULL;
            }
        }
        if (value instanceof BigDecimal decimal && field.type() == FieldType.FLOAT) {
            return DocValue.of(decimal.doubleValue());
        }
        return values.normalize(value);
    }
}
