package io.paramsetconfig.core.export;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one channel's paramset values, for backup, transfer between
 * devices of the same model, or comparison.
 *
 * @param version        document format version
 * @param exportedAt     ISO-8601 export time
 * @param deviceAddress  address of the exported device
 * @param model          device model
 * @param channelAddress address of the exported channel
 * @param channelType    channel type, e.g. "DIMMER_VIRTUAL_RECEIVER"
 * @param paramsetKey    paramset key, e.g. "MASTER"
 * @param values         parameter values
 */
public record ExportedConfiguration(
        String version,
        String exportedAt,
        String deviceAddress,
        String model,
        String channelAddress,
        String channelType,
        String paramsetKey,
        Map<String, Object> values) {

    public ExportedConfiguration {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(exportedAt, "exportedAt must not be null");
        values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }
}
