package io.paramsetconfig.core.time;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between durations in seconds and the base/factor pairs that link
 * time parameters ({@code *_TIME_BASE} / {@code *_TIME_FACTOR}) use.
 *
 * <p>
 * Decoding is exact: {@code seconds = unit(base) * factor}. Encoding searches
 * the bases a {@link TimeSelectorType} allows and may lose precision when the
 * duration is not representable.
 *
 * <p>
 * Stateless, thread-safe.
 */
public final class TimeCodec {

    /** Base unit table in tenths of a second, indexed by base. */
    private static final int[] BASE_UNIT_TENTHS = {1, 10, 50, 100, 600, 3000, 6000, 36000};

    private static final List<TimePreset> TIME_ON_OFF_PRESETS = List.of(
            new TimePreset(0, 0, "Not active", "Nicht aktiv"),
            new TimePreset(0, 1, "100 ms", "100 ms"),
            new TimePreset(1, 1, "1 s", "1 s"),
            new TimePreset(1, 2, "2 s", "2 s"),
            new TimePreset(1, 3, "3 s", "3 s"),
            new TimePreset(2, 1, "5 s", "5 s"),
            new TimePreset(3, 1, "10 s", "10 s"),
            new TimePreset(3, 3, "30 s", "30 s"),
            new TimePreset(4, 1, "1 min", "1 min"),
            new TimePreset(4, 2, "2 min", "2 min"),
            new TimePreset(5, 1, "5 min", "5 min"),
            new TimePreset(6, 1, "10 min", "10 min"),
            new TimePreset(6, 3, "30 min", "30 min"),
            new TimePreset(7, 1, "1 h", "1 h"),
            new TimePreset(7, 2, "2 h", "2 h"),
            new TimePreset(7, 3, "3 h", "3 h"),
            new TimePreset(7, 5, "5 h", "5 h"),
            new TimePreset(7, 8, "8 h", "8 h"),
            new TimePreset(7, 12, "12 h", "12 h"),
            new TimePreset(7, 24, "24 h", "24 h"),
            new TimePreset(7, 31, "Permanent", "Permanent"));

    private static final List<TimePreset> DELAY_PRESETS = List.of(
            new TimePreset(0, 0, "Not active", "Nicht aktiv"),
            new TimePreset(2, 1, "5 s", "5 s"),
            new TimePreset(3, 1, "10 s", "10 s"),
            new TimePreset(3, 3, "30 s", "30 s"),
            new TimePreset(4, 1, "1 min", "1 min"),
            new TimePreset(4, 2, "2 min", "2 min"),
            new TimePreset(5, 1, "5 min", "5 min"),
            new TimePreset(6, 1, "10 min", "10 min"),
            new TimePreset(6, 3, "30 min", "30 min"),
            new TimePreset(7, 1, "1 h", "1 h"));

    private static final List<TimePreset> RAMP_ON_OFF_PRESETS = List.of(
            new TimePreset(0, 0, "Not active", "Nicht aktiv"),
            new TimePreset(0, 2, "200 ms", "200 ms"),
            new TimePreset(0, 5, "500 ms", "500 ms"),
            new TimePreset(1, 1, "1 s", "1 s"),
            new TimePreset(1, 2, "2 s", "2 s"),
            new TimePreset(1, 5, "5 s", "5 s"),
            new TimePreset(1, 10, "10 s", "10 s"),
            new TimePreset(1, 20, "20 s", "20 s"),
            new TimePreset(1, 30, "30 s", "30 s"));

    private static final Map<TimeSelectorType, List<TimePreset>> PRESETS_BY_TYPE = Map.of(
            TimeSelectorType.TIME_ON_OFF, TIME_ON_OFF_PRESETS,
            TimeSelectorType.DELAY, DELAY_PRESETS,
            TimeSelectorType.RAMP_ON_OFF, RAMP_ON_OFF_PRESETS);

    private TimeCodec() {}

    /** Number of entries in the base unit table. */
    public static int baseCount() {
        return BASE_UNIT_TENTHS.length;
    }

    /**
     * Seconds per unit of the given base.
     *
     * @throws IllegalArgumentException if {@code base} is outside the table
     */
    public static double baseUnitSeconds(int base) {
        requireKnownBase(base);
        return BASE_UNIT_TENTHS[base] / 10.0;
    }

    /**
     * Decodes a base/factor pair to seconds.
     *
     * @param base   index into the base unit table
     * @param factor non-negative multiplier
     * @return the duration in seconds
     * @throws IllegalArgumentException for an unknown base or a negative factor
     */
    public static double decodeTimeValue(int base, int factor) {
        requireKnownBase(base);
        if (factor < 0) {
            throw new IllegalArgumentException("time factor must not be negative: " + factor);
        }
        // Integer product first so that e.g. base 0, factor 3 yields exactly 0.3
        return ((long) BASE_UNIT_TENTHS[base] * factor) / 10.0;
    }

    /**
     * Encodes a duration for the given selector type.
     *
     * <p>
     * Every base the selector allows is tried with
     * {@code factor = round(seconds / unit)}, clamped into
     * {@code [0, maxFactor]}. The candidate whose decoded value is closest to
     * {@code seconds} wins; on a tie the smaller base wins, so an exactly
     * representable duration is encoded at the finest granularity that can
     * hold it.
     *
     * @param seconds      non-negative duration
     * @param selectorType the selector whose bases and factor range apply
     * @return the closest representable pair
     * @throws IllegalArgumentException if {@code seconds} is negative, infinite
     *                                  or not a number
     */
    public static TimeValue encodeTimeValue(double seconds, TimeSelectorType selectorType) {
        Objects.requireNonNull(selectorType, "selectorType must not be null");
        if (!Double.isFinite(seconds) || seconds < 0) {
            throw new IllegalArgumentException("duration must be a finite, non-negative number: " + seconds);
        }

        int bestBase = 0;
        int bestFactor = 0;
        double bestError = Double.POSITIVE_INFINITY;
        for (int base = 0; base <= selectorType.maxBase(); base++) {
            double unit = baseUnitSeconds(base);
            long rounded = Math.round(seconds / unit);
            int factor = (int) Math.max(0, Math.min(selectorType.maxFactor(), rounded));
            double error = Math.abs(decodeTimeValue(base, factor) - seconds);
            if (error < bestError) {
                bestError = error;
                bestBase = base;
                bestFactor = factor;
            }
        }
        return new TimeValue(bestBase, bestFactor);
    }

    /** Presets offered for a selector type, in display order. */
    public static List<TimePreset> presets(TimeSelectorType selectorType) {
        Objects.requireNonNull(selectorType, "selectorType must not be null");
        return PRESETS_BY_TYPE.getOrDefault(selectorType, List.of());
    }

    /**
     * Presets for a selector type as {@code {base, factor, label}} rows with
     * labels for the given locale.
     */
    public static List<Map<String, Object>> presetOptions(TimeSelectorType selectorType, String locale) {
        List<Map<String, Object>> options = new ArrayList<>();
        for (TimePreset preset : presets(selectorType)) {
            options.add(Map.of("base", preset.base(), "factor", preset.factor(), "label", preset.label(locale)));
        }
        return options;
    }

    /**
     * The preset whose duration is closest to {@code seconds}; the first one
     * wins on a tie.
     */
    public static TimePreset nearestPreset(double seconds, TimeSelectorType selectorType) {
        TimePreset best = null;
        double bestDiff = Double.POSITIVE_INFINITY;
        for (TimePreset preset : presets(selectorType)) {
            double diff = Math.abs(decodeTimeValue(preset.base(), preset.factor()) - seconds);
            if (diff < bestDiff) {
                bestDiff = diff;
                best = preset;
            }
        }
        return best;
    }

    private static void requireKnownBase(int base) {
        if (base < 0 || base >= BASE_UNIT_TENTHS.length) {
            throw new IllegalArgumentException("unknown time base: " + base);
        }
    }
}
