package io.paramsetconfig.core.engine;

import java.util.Objects;

/**
 * Identifies where a session's changes were written, for the change log.
 *
 * @param entryId        owning config entry id
 * @param interfaceId    device interface id
 * @param channelAddress written channel address
 * @param deviceName     device display name
 * @param deviceModel    device model
 * @param paramsetKey    written paramset key
 * @param source         what triggered the write
 */
public record CommitContext(
        String entryId,
        String interfaceId,
        String channelAddress,
        String deviceName,
        String deviceModel,
        String paramsetKey,
        String source) {

    public CommitContext {
        Objects.requireNonNull(entryId, "entryId must not be null");
        Objects.requireNonNull(channelAddress, "channelAddress must not be null");
        Objects.requireNonNull(paramsetKey, "paramsetKey must not be null");
    }
}
