package io.paramsetconfig.core.spi;

import io.paramsetconfig.core.model.ParameterDescriptor;
import io.paramsetconfig.core.model.ValidationResult;
import java.util.Optional;

/**
 * Descriptor-driven value checking, supplied to sessions by the caller.
 *
 * <p>
 * Sessions own value state only; knowledge of parameter types, bounds and
 * value lists lives behind this interface. Implementations MUST be stateless
 * or thread-safe and MUST NOT throw for invalid values; failures are
 * returned.
 */
public interface ParameterValidator {

    /**
     * Checks one value against its descriptor.
     *
     * @param descriptor the parameter descriptor
     * @param value      the value to check, possibly {@code null}
     * @return the failure, or empty if the value is valid
     */
    Optional<ValidationResult> validateValue(ParameterDescriptor descriptor, Object value);

    /**
     * Converts a value to the representation the device expects for the
     * descriptor's type (e.g. an enum label to its index). Values that cannot
     * be converted are returned unchanged.
     */
    default Object coerce(ParameterDescriptor descriptor, Object value) {
        return value;
    }
}
