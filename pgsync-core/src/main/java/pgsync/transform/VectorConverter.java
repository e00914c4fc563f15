package pgsync.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts vector-like values to a list of doubles.
 *
 * <p>Accepts lists and other non-set iterables, object and primitive numeric arrays,
 * and the bracketed text form {@code "[0.1, 0.2]"} that PostgreSQL vector columns
 * return. Elements may be numbers or numeric strings.
 */
public final class VectorConverter {

    /**
     * @return the vector, or {@code null} if {@code value} is {@code null}
     * @throws IllegalArgumentException if the value or one of its elements is not numeric
     */
    public List<Double> toFloats(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return parse(s);
        }
        if (value instanceof double[] doubles) {
            List<Double> out = new ArrayList<>(doubles.length);
            for (double d : doubles) {
                out.add(d);
            }
            return out;
        }
        if (value instanceof float[] floats) {
            List<Double> out = new ArrayList<>(floats.length);
            for (float f : floats) {
                out.add((double) f);
            }
            return out;
        }
        if (value instanceof int[] ints) {
            return coerce(Arrays.stream(ints).boxed().toList());
        }
        if (value instanceof long[] longs) {
            return coerce(Arrays.stream(longs).boxed().toList());
        }
        if (value instanceof Object[] array) {
            return coerce(Arrays.asList(array));
        }
        if (value instanceof Iterable<?> iterable && !(value instanceof Set<?>)) {
            return coerce(iterable);
        }
        throw new IllegalArgumentException("Unsupported vector type: " + value.getClass().getSimpleName()
            + (value instanceof Map<?, ?> ? " (mappings are not vectors)" : ""));
    }

    private List<Double> parse(String raw) {
        String text = raw.strip();
        if (!text.startsWith("[") || !text.endsWith("]")) {
            throw new IllegalArgumentException("Vector string must be bracketed: " + raw);
        }
        String inner = text.substring(1, text.length() - 1).strip();
        List<Double> out = new ArrayList<>();
        if (inner.isEmpty()) {
            return out;
        }
        for (String part : inner.split(",")) {
            out.add(parseElement(part, raw));
        }
        return out;
    }

    private List<Double> coerce(Iterable<?> items) {
        List<Double> out = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Number n) {
                out.add(n.doubleValue());
            } else if (item instanceof Boolean b) {
                out.add(b ? 1.0 : 0.0);
            } else if (item instanceof String s) {
                out.add(parseElement(s, s));
            } else {
                throw new IllegalArgumentException("Vector element is not numeric: " + item);
            }
        }
        return out;
    }

    private static double parseElement(String element, String source) {
        try {
            return Double.parseDouble(element.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Vector element is not numeric: '" + element.strip()
                + "' in " + source, e);
        }
    }
}
