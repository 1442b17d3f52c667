package io.paramsetconfig.core.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Equality and conversion helpers for parameter values.
 *
 * <p>
 * A parameter value is an opaque scalar: {@link Boolean}, any {@link Number},
 * or {@link String}. Numbers compare by numeric value regardless of their boxed
 * type, so {@code 1}, {@code 1L} and {@code 1.0} are equal. Booleans never
 * equal numbers.
 */
public final class ParameterValues {

    private ParameterValues() {}

    /**
     * Compares two parameter values. {@code null} (absent) only equals
     * {@code null}.
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb) == 0;
        }
        return a.equals(b);
    }

    /**
     * Compares two value mappings: same key set, and {@link #valuesEqual} for
     * every key.
     */
    public static boolean mapsEqual(Map<String, ?> a, Map<String, ?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<String, ?> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey())) {
                return false;
            }
            if (!valuesEqual(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /** Returns true for {@code null}, booleans, numbers and strings. */
    public static boolean isScalar(Object value) {
        return value == null || value instanceof Boolean || value instanceof Number || value instanceof String;
    }

    /**
     * Numeric view of a value. Empty for absent, boolean and string values.
     */
    public static OptionalDouble asDouble(Object value) {
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        return OptionalDouble.empty();
    }

    /**
     * Total ordering over numbers of mixed boxed types. Non-finite doubles fall
     * back to {@link Double#compare}.
     */
    public static int compareNumbers(Number a, Number b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return Double.isFinite(n.doubleValue());
        }
        return true;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.toString());
    }
}
