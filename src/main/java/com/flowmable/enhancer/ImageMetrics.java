package com.flowmable.enhancer;

/**
 * The four scalar quality metrics the fuzzy engine consumes.
 * <p>
 * Values are not validated. Out-of-range inputs simply fall outside every
 * term's support and fuzzify to 0.
 *
 * @param brightness Mean luma [0–255]
 * @param contrast   Normalized luma standard deviation [0–100]
 * @param sharpness  Normalized Laplacian energy [0–100]
 * @param noise      Normalized local high-frequency deviation [0–100]
 */
public record ImageMetrics(
        double brightness,
        double contrast,
        double sharpness,
        double noise
) {
    /**
     * Metric value for an input variable name.
     *
     * @throws IllegalArgumentException for a name that is not an input variable
     */
    public double valueOf(String variable) {
        return switch (variable) {
            case LinguisticVariables.BRIGHTNESS -> brightness;
            case LinguisticVariables.CONTRAST -> contrast;
            case LinguisticVariables.SHARPNESS -> sharpness;
            case LinguisticVariables.NOISE -> noise;
            default -> throw new IllegalArgumentException("Not an input variable: " + variable);
        };
    }
}
