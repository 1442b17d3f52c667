package io.paramsetconfig.core.time;

/**
 * A selectable duration offered by a time picker.
 *
 * @param base    base index
 * @param factor  factor
 * @param labelEn English label
 * @param labelDe German label
 */
public record TimePreset(int base, int factor, String labelEn, String labelDe) {

    /** Label for a locale; German for "de", English otherwise. */
    public String label(String locale) {
        return "de".equalsIgnoreCase(locale) ? labelDe : labelEn;
    }

    /** The encoded value of this preset. */
    public TimeValue value() {
        return new TimeValue(base, factor);
    }
}
