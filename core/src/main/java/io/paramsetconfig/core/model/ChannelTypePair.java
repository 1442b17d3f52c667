package io.paramsetconfig.core.model;

import java.util.Objects;

/**
 * Catalog key: the channel type that sends a link and the channel type that
 * receives it.
 *
 * @param senderChannelType   e.g. "SWITCH_TRANSCEIVER"
 * @param receiverChannelType e.g. "DIMMER_VIRTUAL_RECEIVER"
 */
public record ChannelTypePair(String senderChannelType, String receiverChannelType) {

    public ChannelTypePair {
        Objects.requireNonNull(senderChannelType, "senderChannelType must not be null");
        Objects.requireNonNull(receiverChannelType, "receiverChannelType must not be null");
    }

    @Override
    public String toString() {
        return senderChannelType + "->" + receiverChannelType;
    }
}
