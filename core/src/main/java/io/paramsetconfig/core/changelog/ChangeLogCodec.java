package io.paramsetconfig.core.changelog;

import io.paramsetconfig.core.error.ChangeLogLoadException;
import io.paramsetconfig.core.model.ParameterValues;
import io.paramsetconfig.core.model.ValueChange;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link ChangeLogEntry} to and from the plain mapping shape used
 * for persistence: snake_case field names, {@code changes} as nested
 * {@code {param: {old, new}}} mappings, {@code timestamp} as an ISO-8601
 * string.
 *
 * <p>
 * Missing fields are tolerated (legacy entries) and default to {@code ""} or
 * an empty mapping. Fields of the wrong type are not: they raise
 * {@link ChangeLogLoadException}.
 */
final class ChangeLogCodec {

    static final String TIMESTAMP = "timestamp";
    static final String ENTRY_ID = "entry_id";
    static final String INTERFACE_ID = "interface_id";
    static final String CHANNEL_ADDRESS = "channel_address";
    static final String DEVICE_NAME = "device_name";
    static final String DEVICE_MODEL = "device_model";
    static final String PARAMSET_KEY = "paramset_key";
    static final String CHANGES = "changes";
    static final String SOURCE = "source";
    static final String OLD = "old";
    static final String NEW = "new";

    static final List<String> FIELDS = List.of(
            TIMESTAMP, ENTRY_ID, INTERFACE_ID, CHANNEL_ADDRESS, DEVICE_NAME, DEVICE_MODEL, PARAMSET_KEY, CHANGES, SOURCE);

    private ChangeLogCodec() {}

    static Map<String, Object> toMap(ChangeLogEntry entry) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(TIMESTAMP, entry.timestamp());
        map.put(ENTRY_ID, entry.entryId());
        map.put(INTERFACE_ID, entry.interfaceId());
        map.put(CHANNEL_ADDRESS, entry.channelAddress());
        map.put(DEVICE_NAME, entry.deviceName());
        map.put(DEVICE_MODEL, entry.deviceModel());
        map.put(PARAMSET_KEY, entry.paramsetKey());
        map.put(CHANGES, changesToMap(entry.changes()));
        map.put(SOURCE, entry.source());
        return map;
    }

    static Map<String, Map<String, Object>> changesToMap(Map<String, ValueChange> changes) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        changes.forEach((parameter, change) -> {
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put(OLD, change.oldValue());
            pair.put(NEW, change.newValue());
            result.put(parameter, pair);
        });
        return result;
    }

    /**
     * Restores one entry.
     *
     * @param raw   the serialized entry
     * @param index position in the loaded list, for error messages
     * @throws ChangeLogLoadException if {@code raw} is not a mapping or a field
     *                                has the wrong type
     */
    static ChangeLogEntry fromMap(Object raw, int index) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ChangeLogLoadException(
                    "Change log entry[" + index + "] must be a mapping, got " + typeName(raw));
        }
        return new ChangeLogEntry(
                string(map, TIMESTAMP, index),
                string(map, ENTRY_ID, index),
                string(map, INTERFACE_ID, index),
                string(map, CHANNEL_ADDRESS, index),
                string(map, DEVICE_NAME, index),
                string(map, DEVICE_MODEL, index),
                string(map, PARAMSET_KEY, index),
                changes(map.get(CHANGES), index),
                string(map, SOURCE, index));
    }

    /** Number of known fields absent from a serialized entry. */
    static int missingFieldCount(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return 0;
        }
        int missing = 0;
        for (String field : FIELDS) {
            if (!map.containsKey(field)) {
                missing++;
            }
        }
        return missing;
    }

    private static String string(Map<?, ?> map, String field, int index) {
        Object value = map.get(field);
        if (value == null) {
            return "";
        }
        if (!(value instanceof String s)) {
            throw new ChangeLogLoadException(String.format(
                    "Change log entry[%d]: field '%s' must be a string, got %s", index, field, typeName(value)));
        }
        return s;
    }

    private static Map<String, ValueChange> changes(Object raw, int index) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ChangeLogLoadException(String.format(
                    "Change log entry[%d]: field 'changes' must be a mapping, got %s", index, typeName(raw)));
        }
        Map<String, ValueChange> changes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String parameter = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> pair)) {
                throw new ChangeLogLoadException(String.format(
                        "Change log entry[%d]: change for '%s' must be an {old, new} mapping, got %s",
                        index, parameter, typeName(entry.getValue())));
            }
            Object oldValue = pair.get(OLD);
            Object newValue = pair.get(NEW);
            if (!ParameterValues.isScalar(oldValue) || !ParameterValues.isScalar(newValue)) {
                throw new ChangeLogLoadException(String.format(
                        "Change log entry[%d]: change for '%s' must hold scalar values", index, parameter));
            }
            changes.put(parameter, new ValueChange(oldValue, newValue));
        }
        return changes;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
