package io.paramsetconfig.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Restriction a profile places on one parameter. Closed over three shapes:
 * {@link Fixed}, {@link OneOf} (an enumerated list) and {@link Range}.
 *
 * <p>
 * The compact constructors reject structurally invalid constraints, so a
 * constraint instance that exists is always well-formed. Matching code can
 * therefore switch on {@link #kind()} without defensive checks.
 *
 * <p>
 * Immutable, thread-safe.
 */
public sealed interface ParamConstraint permits ParamConstraint.Fixed, ParamConstraint.OneOf, ParamConstraint.Range {

    /** Shape tag, matching the {@code constraint_type} catalog field. */
    enum Kind {
        FIXED("fixed"),
        LIST("list"),
        RANGE("range");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        /** The catalog spelling of this kind. */
        public String wireName() {
            return wireName;
        }

        /**
         * Looks up a kind by its catalog spelling.
         *
         * @return the kind, or {@code null} if unknown
         */
        public static Kind fromWireName(String name) {
            for (Kind kind : values()) {
                if (kind.wireName.equals(name)) {
                    return kind;
                }
            }
            return null;
        }
    }

    /** The shape of this constraint. */
    Kind kind();

    /**
     * Tests a current value against this constraint.
     *
     * @param value the current value, or {@code null} if the parameter is
     *              absent (absent never satisfies a constraint)
     */
    boolean isSatisfiedBy(Object value);

    /** The profile's suggested value, or {@code null} (always null for fixed). */
    Object defaultValue();

    /** Parameter must equal exactly {@code value}. */
    record Fixed(Object value) implements ParamConstraint {

        public Fixed {
            Objects.requireNonNull(value, "fixed value must not be null");
            requireScalar(value, "fixed value");
        }

        @Override
        public Kind kind() {
            return Kind.FIXED;
        }

        @Override
        public boolean isSatisfiedBy(Object current) {
            return current != null && ParameterValues.valuesEqual(current, value);
        }

        @Override
        public Object defaultValue() {
            return null;
        }
    }

    /**
     * Parameter must be one of {@code values}.
     *
     * @param values       allowed values, non-empty, definition order kept
     * @param defaultValue suggested value; must be a member of {@code values}
     *                     when present
     */
    record OneOf(List<Object> values, Object defaultValue) implements ParamConstraint {

        public OneOf {
            Objects.requireNonNull(values, "list values must not be null");
            if (values.isEmpty()) {
                throw new IllegalArgumentException("list constraint must declare at least one value");
            }
            for (Object v : values) {
                Objects.requireNonNull(v, "list values must not contain null");
                requireScalar(v, "list value");
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
            if (defaultValue != null && !contains(values, defaultValue)) {
                throw new IllegalArgumentException(
                        "list default " + defaultValue + " is not one of the allowed values " + values);
            }
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public boolean isSatisfiedBy(Object current) {
            return current != null && contains(values, current);
        }

        private static boolean contains(List<Object> values, Object candidate) {
            for (Object v : values) {
                if (ParameterValues.valuesEqual(v, candidate)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Parameter must lie within {@code [min, max]} (both inclusive).
     *
     * @param min          lower bound
     * @param max          upper bound, {@code >= min}
     * @param defaultValue suggested value within the range, or {@code null}
     */
    record Range(double min, double max, Double defaultValue) implements ParamConstraint {

        public Range {
            if (Double.isNaN(min) || Double.isNaN(max)) {
                throw new IllegalArgumentException("range bounds must be numbers");
            }
            if (min > max) {
                throw new IllegalArgumentException("range min " + min + " is greater than max " + max);
            }
            if (defaultValue != null && (defaultValue < min || defaultValue > max)) {
                throw new IllegalArgumentException(
                        "range default " + defaultValue + " lies outside [" + min + ", " + max + "]");
            }
        }

        @Override
        public Kind kind() {
            return Kind.RANGE;
        }

        @Override
        public boolean isSatisfiedBy(Object current) {
            OptionalDouble numeric = ParameterValues.asDouble(current);
            if (numeric.isEmpty()) {
                return false;
            }
            double v = numeric.getAsDouble();
            return min <= v && v <= max;
        }
    }

    /** Creates a {@link Fixed} constraint. */
    static ParamConstraint fixed(Object value) {
        return new Fixed(value);
    }

    /** Creates a {@link OneOf} constraint. */
    static ParamConstraint oneOf(List<Object> values, Object defaultValue) {
        return new OneOf(values, defaultValue);
    }

    /** Creates a {@link Range} constraint. */
    static ParamConstraint range(double min, double max, Double defaultValue) {
        return new Range(min, max, defaultValue);
    }

    private static void requireScalar(Object value, String what) {
        if (!ParameterValues.isScalar(value)) {
            throw new IllegalArgumentException(what + " must be a boolean, number or string: " + value);
        }
    }
}
