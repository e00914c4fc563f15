package pgsync.transform;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import pgsync.document.DocValue;

/**
 * Fallback conversion for fields without a source type.
 *
 * <p>Strings, booleans and numbers keep their kind; {@link BigDecimal} is rendered as
 * plain text so no digits are lost. Lists and arrays become arrays and maps become
 * nested objects, element by element. Date/time objects become epoch seconds and
 * time-of-day values become {@code HH:mm:ss} text. Byte arrays are Base64 encoded;
 * everything else is rendered with {@code toString()}.
 */
public final class ValueNormalizer {
    private final DateConverter dates;

    public ValueNormalizer(DateConverter dates) {
        this.dates = Objects.requireNonNull(dates, "dates");
    }

    public DocValue normalize(Object value) {
        if (value == null) {
            return DocValue.NULL;
        }
        if (value instanceof DocValue docValue) {
            return docValue;
        }
        if (value instanceof String s) {
            return DocValue.of(s);
        }
        if (value instanceof Character c) {
            return DocValue.of(c.toString());
        }
        if (value instanceof Boolean b) {
            return DocValue.of(b.booleanValue());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return DocValue.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? DocValue.of(big.longValue()) : DocValue.of(big.toString());
        }
        if (value instanceof BigDecimal decimal) {
            return DocValue.of(decimal.toPlainString());
        }
        if (value instanceof Double || value instanceof Float) {
            return DocValue.of(((Number) value).doubleValue());
        }
        if (value instanceof Number n) {
            return DocValue.of(n.toString());
        }
        if (value instanceof java.sql.Time time) {
            return DocValue.of(DateTimeFormatter.ISO_LOCAL_TIME.format(time.toLocalTime()));
        }
        if (value instanceof LocalTime time) {
            return DocValue.of(DateTimeFormatter.ISO_LOCAL_TIME.format(time));
        }
        if (value instanceof byte[] bytes) {
            return DocValue.of(Base64.getEncoder().encodeToString(bytes));
        }
        if (value instanceof Collection<?> items) {
            return array(items);
        }
        if (value instanceof Object[] items) {
            return array(Arrays.asList(items));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, DocValue> fields = new LinkedHashMap<>();
            map.forEach((key, item) -> fields.put(String.valueOf(key), normalize(item)));
            return new DocValue.Obj(fields);
        }
        Long epochSeconds = dates.fromTemporal(value);
        if (epochSeconds != null) {
            return DocValue.of(epochSeconds.longValue());
        }
        return DocValue.of(value.toString());
    }

    private DocValue array(Collection<?> items) {
        List<DocValue> out = new ArrayList<>(items.size());
        for (Object item : items) {
            out.add(normalize(item));
        }
        return new DocValue.Array(out);
    }
}
