package io.paramsetconfig.core.time;

/**
 * A duration in base/factor encoding.
 *
 * @param base   index into the base unit table (0..7)
 * @param factor multiplier of the base unit
 */
public record TimeValue(int base, int factor) {

    /** Decodes this pair to seconds. */
    public double seconds() {
        return TimeCodec.decodeTimeValue(base, factor);
    }
}
