package io.paramsetconfig.core.validation;

import io.paramsetconfig.core.model.ParameterDescriptor;
import io.paramsetconfig.core.model.ParameterValues;
import io.paramsetconfig.core.model.ValidationResult;
import io.paramsetconfig.core.spi.ParameterValidator;
import java.util.Locale;
import java.util.Optional;

/**
 * Default {@link ParameterValidator}: checks the value's type against the
 * descriptor's type tag, numeric bounds for {@code INTEGER} / {@code FLOAT},
 * and membership for {@code ENUM} (by index or by label).
 *
 * <p>
 * Stateless, thread-safe.
 */
public final class DescriptorValidator implements ParameterValidator {

    /** Shared instance. */
    public static final DescriptorValidator INSTANCE = new DescriptorValidator();

    @Override
    public Optional<ValidationResult> validateValue(ParameterDescriptor descriptor, Object value) {
        String id = descriptor.id();
        if (value == null) {
            return fail(id, null, "value is missing");
        }
        return switch (descriptor.type()) {
            case BOOL, ACTION -> value instanceof Boolean ? Optional.empty() : fail(id, value, "expected a boolean");
            case INTEGER -> validateInteger(descriptor, value);
            case FLOAT -> validateNumber(descriptor, value);
            case ENUM -> validateEnum(descriptor, value);
            case STRING -> value instanceof String ? Optional.empty() : fail(id, value, "expected a string");
        };
    }

    @Override
    public Object coerce(ParameterDescriptor descriptor, Object value) {
        if (value == null) {
            return null;
        }
        return switch (descriptor.type()) {
            case BOOL, ACTION -> coerceBoolean(value);
            case INTEGER -> coerceInteger(value);
            case FLOAT -> value instanceof Number n ? (Object) n.doubleValue() : parseDoubleOr(value);
            case ENUM -> coerceEnum(descriptor, value);
            case STRING -> value instanceof String ? value : String.valueOf(value);
        };
    }

    private Optional<ValidationResult> validateInteger(ParameterDescriptor descriptor, Object value) {
        if (!(value instanceof Number n) || !isIntegral(n)) {
            return fail(descriptor.id(), value, "expected an integer");
        }
        return checkBounds(descriptor, n);
    }

    private Optional<ValidationResult> validateNumber(ParameterDescriptor descriptor, Object value) {
        if (!(value instanceof Number n)) {
            return fail(descriptor.id(), value, "expected a number");
        }
        return checkBounds(descriptor, n);
    }

    private Optional<ValidationResult> checkBounds(ParameterDescriptor descriptor, Number n) {
        if (descriptor.min() != null && ParameterValues.compareNumbers(n, descriptor.min()) < 0) {
            return fail(descriptor.id(), n, "value " + n + " below minimum " + descriptor.min());
        }
        if (descriptor.max() != null && ParameterValues.compareNumbers(n, descriptor.max()) > 0) {
            return fail(descriptor.id(), n, "value " + n + " above maximum " + descriptor.max());
        }
        return Optional.empty();
    }

    private Optional<ValidationResult> validateEnum(ParameterDescriptor descriptor, Object value) {
        if (value instanceof String label) {
            return descriptor.valueList().contains(label)
                    ? Optional.empty()
                    : fail(descriptor.id(), value, "'" + label + "' is not one of " + descriptor.valueList());
        }
        if (value instanceof Number n && isIntegral(n)) {
            long index = n.longValue();
            return index >= 0 && index < descriptor.valueList().size()
                    ? Optional.empty()
                    : fail(descriptor.id(), value, "enum index " + index + " out of range");
        }
        return fail(descriptor.id(), value, "expected an enum label or index");
    }

    private static Object coerceBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "1".equals(text)) {
            return Boolean.TRUE;
        }
        if ("false".equals(text) || "0".equals(text)) {
            return Boolean.FALSE;
        }
        return value;
    }

    private static Object coerceInteger(Object value) {
        if (value instanceof Number n && isIntegral(n)) {
            long l = n.longValue();
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (Object) (int) l : (Object) l;
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }

    private static Object coerceEnum(ParameterDescriptor descriptor, Object value) {
        if (value instanceof String label) {
            int index = descriptor.valueList().indexOf(label);
            return index >= 0 ? (Object) index : value;
        }
        return coerceInteger(value);
    }

    private static Object parseDoubleOr(Object value) {
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return true;
        }
        double d = n.doubleValue();
        return Double.isFinite(d) && d == Math.rint(d);
    }

    private static Optional<ValidationResult> fail(String parameter, Object value, String reason) {
        return Optional.of(new ValidationResult(parameter, value, reason));
    }
}
