package com.flowmable.enhancer;

/**
 * Crisp enhancement settings produced by inference and consumed by {@link ImageEnhancer}.
 *
 * @param brightnessAdj Additive channel offset [-100, 100]; neutral 0
 * @param contrastAdj   Multiplicative contrast about mid-grey [0.5, 2.0]; neutral 1
 * @param sharpen       Sharpen amount [0, 100]; neutral 0
 * @param denoise       Box-blur strength [0, 100]; neutral 0
 */
public record EnhancementParameters(
        double brightnessAdj,
        double contrastAdj,
        double sharpen,
        double denoise
) {
    /** Neutral values, used for any output variable no fired rule addressed. */
    public static final EnhancementParameters DEFAULT = new EnhancementParameters(
            0.0, // brightnessAdj
            1.0, // contrastAdj
            0.0, // sharpen
            0.0  // denoise
    );

    /** Copy with one field replaced, by output variable name. */
    public EnhancementParameters with(String variable, double value) {
        return switch (variable) {
            case LinguisticVariables.BRIGHTNESS_ADJ -> new EnhancementParameters(value, contrastAdj, sharpen, denoise);
            case LinguisticVariables.CONTRAST_ADJ -> new EnhancementParameters(brightnessAdj, value, sharpen, denoise);
            case LinguisticVariables.SHARPEN -> new EnhancementParameters(brightnessAdj, contrastAdj, value, denoise);
            case LinguisticVariables.DENOISE -> new EnhancementParameters(brightnessAdj, contrastAdj, sharpen, value);
            default -> throw new IllegalArgumentException("Not an output variable: " + variable);
        };
    }

    public double valueOf(String variable) {
        return switch (variable) {
            case LinguisticVariables.BRIGHTNESS_ADJ -> brightnessAdj;
            case LinguisticVariables.CONTRAST_ADJ -> contrastAdj;
            case LinguisticVariables.SHARPEN -> sharpen;
            case LinguisticVariables.DENOISE -> denoise;
            default -> throw new IllegalArgumentException("Not an output variable: " + variable);
        };
    }

    public boolean isNeutral() {
        return equals(DEFAULT);
    }
}
