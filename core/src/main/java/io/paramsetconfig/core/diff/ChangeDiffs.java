package io.paramsetconfig.core.diff;

import io.paramsetconfig.core.model.ParameterValues;
import io.paramsetconfig.core.model.ValueChange;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Field-by-field difference between two value mappings. The resulting
 * {@code Map<String, ValueChange>} is the diff shape exchanged between
 * sessions, the change log and persistence callers.
 *
 * <p>
 * Stateless, thread-safe.
 */
public final class ChangeDiffs {

    private ChangeDiffs() {}

    /**
     * Builds the diff from {@code oldValues} to {@code newValues}. Every key of
     * {@code newValues} whose value differs from the old one is reported; a key
     * missing from {@code oldValues} counts as different with a {@code null}
     * old value. Keys only present in {@code oldValues} are not reported.
     *
     * @param oldValues the baseline values
     * @param newValues the values to compare against the baseline
     * @return unmodifiable diff in {@code newValues} iteration order; empty if
     *         nothing changed
     */
    public static Map<String, ValueChange> buildChangeDiff(Map<String, ?> oldValues, Map<String, ?> newValues) {
        Objects.requireNonNull(oldValues, "oldValues must not be null");
        Objects.requireNonNull(newValues, "newValues must not be null");

        Map<String, ValueChange> changes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : newValues.entrySet()) {
            Object oldValue = oldValues.get(entry.getKey());
            if (!ParameterValues.valuesEqual(oldValue, entry.getValue())) {
                changes.put(entry.getKey(), new ValueChange(oldValue, entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(changes);
    }

    /**
     * Extracts the new values of a diff, i.e. the partial update a device write
     * expects.
     */
    public static Map<String, Object> newValues(Map<String, ValueChange> diff) {
        Map<String, Object> values = new LinkedHashMap<>();
        diff.forEach((parameter, change) -> values.put(parameter, change.newValue()));
        return values;
    }
}
