package ai.palicorpus.translator.sanitize;

/**
 * Validation thresholds.
 *
 * @param maxLengthRatio output may not exceed this multiple of the source length
 * @param minimumLengthAllowance output length always accepted regardless of the ratio, so short titles may expand
 * @param minScriptRatio minimum share of letters written in the target script
 */
public record SanitizerSettings(double maxLengthRatio, int minimumLengthAllowance, double minScriptRatio) {

    public static final double DEFAULT_MAX_LENGTH_RATIO = 5.0;
    public static final int DEFAULT_MINIMUM_LENGTH_ALLOWANCE = 40;
    public static final double DEFAULT_MIN_SCRIPT_RATIO = 0.5;

    public SanitizerSettings {
        if (maxLengthRatio < 1.0) {
            throw new IllegalArgumentException("maxLengthRatio must be at least 1.0");
        }
        if (minimumLengthAllowance < 0) {
            throw new IllegalArgumentException("minimumLengthAllowance must not be negative");
        }
        if (minScriptRatio < 0.0 || minScriptRatio > 1.0) {
            throw new IllegalArgumentException("minScriptRatio must be between 0.0 and 1.0");
        }
    }

    public static SanitizerSettings defaults() {
        return new SanitizerSettings(DEFAULT_MAX_LENGTH_RATIO, DEFAULT_MINIMUM_LENGTH_ALLOWANCE, DEFAULT_MIN_SCRIPT_RATIO);
    }
}
