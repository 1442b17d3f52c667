package io.paramsetconfig.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Description of one paramset parameter, supplied by the caller from the
 * device description. Sessions consume descriptors but never build them.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param id           parameter id (e.g. "TEMPERATURE_OFFSET")
 * @param type         type tag
 * @param writable     whether the device accepts writes for this parameter
 * @param defaultValue factory default, or {@code null} if none is known
 * @param min          lower bound for numeric types, or {@code null}
 * @param max          upper bound for numeric types, or {@code null}
 * @param valueList    allowed labels for {@link ParameterType#ENUM}; empty
 *                     otherwise
 */
public record ParameterDescriptor(
        String id,
        ParameterType type,
        boolean writable,
        Object defaultValue,
        Number min,
        Number max,
        List<String> valueList) {

    /** Validates required fields. */
    public ParameterDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        valueList = valueList != null ? Collections.unmodifiableList(new ArrayList<>(valueList)) : List.of();
    }

    /**
     * Returns a new {@link Builder} for the given parameter.
     *
     * @param id   the parameter id
     * @param type the type tag
     * @return a fresh builder, writable by default
     */
    public static Builder builder(String id, ParameterType type) {
        return new Builder(id, type);
    }

    /** Fluent builder; unset bounds and defaults stay {@code null}. */
    public static final class Builder {

        private final String id;
        private final ParameterType type;
        private boolean writable = true;
        private Object defaultValue;
        private Number min;
        private Number max;
        private List<String> valueList = List.of();

        Builder(String id, ParameterType type) {
            this.id = id;
            this.type = type;
        }

        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder range(Number min, Number max) {
            this.min = min;
            this.max = max;
            return this;
        }

        public Builder valueList(List<String> valueList) {
            this.valueList = valueList;
            return this;
        }

        public ParameterDescriptor build() {
            return new ParameterDescriptor(id, type, writable, defaultValue, min, max, valueList);
        }
    }
}
