package io.paramsetconfig.core.changelog;

import io.paramsetconfig.core.model.ValueChange;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One committed paramset change. Created by {@link ConfigChangeLog#add} or
 * restored by {@link ConfigChangeLog#loadEntries}; never mutated afterwards.
 *
 * @param timestamp      ISO-8601 time the entry was recorded
 * @param entryId        id of the config entry (integration instance) that
 *                       owns the device
 * @param interfaceId    device interface id
 * @param channelAddress address of the written channel
 * @param deviceName     display name of the device
 * @param deviceModel    device model
 * @param paramsetKey    paramset written, e.g. "MASTER" or a link peer address
 * @param changes        per-parameter old/new values
 * @param source         what triggered the write, e.g. "panel" or "import"
 */
public record ChangeLogEntry(
        String timestamp,
        String entryId,
        String interfaceId,
        String channelAddress,
        String deviceName,
        String deviceModel,
        String paramsetKey,
        Map<String, ValueChange> changes,
        String source) {

    public ChangeLogEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(entryId, "entryId must not be null");
        interfaceId = nullToEmpty(interfaceId);
        channelAddress = nullToEmpty(channelAddress);
        deviceName = nullToEmpty(deviceName);
        deviceModel = nullToEmpty(deviceModel);
        paramsetKey = nullToEmpty(paramsetKey);
        source = nullToEmpty(source);
        changes = changes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(changes)) : Map.of();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
