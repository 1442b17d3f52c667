package io.paramsetconfig.core.time;

import java.util.Locale;
import java.util.Map;

/**
 * Kind of duration a link time parameter expresses. Determines which base
 * units and factors the encoder may use and which presets a picker offers.
 */
public enum TimeSelectorType {
    TIME_ON_OFF("timeOnOff", 7, 31),
    DELAY("delay", 7, 31),
    RAMP_ON_OFF("rampOnOff", 3, 31);

    private static final Map<String, TimeSelectorType> BY_TIME_STEM = Map.of(
            "ON_TIME", TIME_ON_OFF,
            "OFF_TIME", TIME_ON_OFF,
            "ONDELAY_TIME", DELAY,
            "OFFDELAY_TIME", DELAY,
            "ON_DELAY_TIME", DELAY,
            "OFF_DELAY_TIME", DELAY,
            "RAMP_ON_TIME", RAMP_ON_OFF,
            "RAMP_OFF_TIME", RAMP_ON_OFF,
            "RAMPON_TIME", RAMP_ON_OFF,
            "RAMPOFF_TIME", RAMP_ON_OFF);

    private final String wireName;
    private final int maxBase;
    private final int maxFactor;

    TimeSelectorType(String wireName, int maxBase, int maxFactor) {
        this.wireName = wireName;
        this.maxBase = maxBase;
        this.maxFactor = maxFactor;
    }

    /** Name used by front ends (e.g. "timeOnOff"). */
    public String wireName() {
        return wireName;
    }

    /** Highest base index the encoder may choose for this selector. */
    public int maxBase() {
        return maxBase;
    }

    /** Highest factor representable for this selector. */
    public int maxFactor() {
        return maxFactor;
    }

    /**
     * Maps a time stem such as {@code ON_TIME} or {@code RAMPOFF_TIME} to its
     * selector type.
     *
     * @return the selector type, or {@code null} for unknown stems
     */
    public static TimeSelectorType forTimeStem(String stem) {
        return stem == null ? null : BY_TIME_STEM.get(stem.toUpperCase(Locale.ROOT));
    }

    /**
     * Derives the selector type from a full link parameter id, e.g.
     * {@code SHORT_ON_TIME_BASE} or {@code LONG_OFFDELAY_TIME_FACTOR}.
     *
     * @return the selector type, or {@code null} if the parameter is not a
     *         known time base/factor parameter
     */
    public static TimeSelectorType forParameter(String parameterId) {
        if (parameterId == null) {
            return null;
        }
        String upper = parameterId.toUpperCase(Locale.ROOT);
        if (upper.startsWith("SHORT_")) {
            upper = upper.substring("SHORT_".length());
        } else if (upper.startsWith("LONG_")) {
            upper = upper.substring("LONG_".length());
        }
        String stem;
        if (upper.endsWith("_TIME_BASE")) {
            stem = upper.substring(0, upper.length() - "_BASE".length());
        } else if (upper.endsWith("_TIME_FACTOR")) {
            stem = upper.substring(0, upper.length() - "_FACTOR".length());
        } else {
            return null;
        }
        return forTimeStem(stem);
    }
}
