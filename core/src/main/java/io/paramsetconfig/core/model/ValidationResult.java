package io.paramsetconfig.core.model;

import java.util.Objects;

/**
 * One failed value check.
 *
 * @param parameter the parameter id
 * @param value     the rejected value (may be {@code null})
 * @param reason    human-readable reason, e.g. "value 120 above maximum 100"
 */
public record ValidationResult(String parameter, Object value, String reason) {

    public ValidationResult {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
