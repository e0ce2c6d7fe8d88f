package com.flowmable.enhancer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.flowmable.enhancer.MembershipFunction.trapezoidal;
import static com.flowmable.enhancer.MembershipFunction.triangular;

/**
 * Static registry of the four input and four output linguistic variables.
 * <p>
 * Any modification to a universe or a term shape changes every inference
 * result; rules in {@link RuleBase} refer to these names.
 */
public final class LinguisticVariables {

    private LinguisticVariables() {}

    public static final String BRIGHTNESS = "brightness";
    public static final String CONTRAST = "contrast";
    public static final String SHARPNESS = "sharpness";
    public static final String NOISE = "noise";

    public static final String BRIGHTNESS_ADJ = "brightnessAdj";
    public static final String CONTRAST_ADJ = "contrastAdj";
    public static final String SHARPEN = "sharpen";
    public static final String DENOISE = "denoise";

    // --- Inputs ---

    public static final LinguisticVariable BRIGHTNESS_VARIABLE = variable(BRIGHTNESS, 0, 255,
            Map.entry("VeryDark", trapezoidal(0, 0, 40, 80)),
            Map.entry("Dark", triangular(40, 80, 120)),
            Map.entry("Normal", triangular(80, 127, 175)),
            Map.entry("Bright", triangular(135, 175, 215)),
            Map.entry("VeryBright", trapezoidal(175, 215, 255, 255)));

    public static final LinguisticVariable CONTRAST_VARIABLE = variable(CONTRAST, 0, 100,
            Map.entry("VeryLow", trapezoidal(0, 0, 15, 25)),
            Map.entry("Low", triangular(15, 25, 40)),
            Map.entry("Medium", triangular(30, 50, 70)),
            Map.entry("High", triangular(60, 75, 90)),
            Map.entry("VeryHigh", trapezoidal(80, 90, 100, 100)));

    public static final LinguisticVariable SHARPNESS_VARIABLE = variable(SHARPNESS, 0, 100,
            Map.entry("VeryBlurry", trapezoidal(0, 0, 15, 30)),
            Map.entry("Blurry", triangular(15, 30, 50)),
            Map.entry("Acceptable", triangular(40, 55, 70)),
            Map.entry("Sharp", triangular(60, 75, 90)),
            Map.entry("VerySharp", trapezoidal(80, 90, 100, 100)));

    public static final LinguisticVariable NOISE_VARIABLE = variable(NOISE, 0, 100,
            Map.entry("Clean", trapezoidal(0, 0, 10, 25)),
            Map.entry("Slight", triangular(15, 30, 50)),
            Map.entry("Moderate", triangular(40, 60, 80)),
            Map.entry("Heavy", trapezoidal(70, 85, 100, 100)));

    // --- Outputs ---

    public static final LinguisticVariable BRIGHTNESS_ADJ_VARIABLE = variable(BRIGHTNESS_ADJ, -100, 100,
            Map.entry("LargeDecrease", trapezoidal(-100, -100, -80, -60)),
            Map.entry("SmallDecrease", triangular(-70, -40, -15)),
            Map.entry("NoChange", triangular(-20, 0, 20)),
            Map.entry("SmallIncrease", triangular(15, 40, 70)),
            Map.entry("LargeIncrease", trapezoidal(60, 80, 100, 100)));

    public static final LinguisticVariable CONTRAST_ADJ_VARIABLE = variable(CONTRAST_ADJ, 0.5, 2.0,
            Map.entry("LargeDecrease", trapezoidal(0.5, 0.5, 0.6, 0.7)),
            Map.entry("SmallDecrease", triangular(0.7, 0.8, 0.9)),
            Map.entry("NoChange", triangular(0.9, 1.0, 1.1)),
            Map.entry("SmallIncrease", triangular(1.1, 1.3, 1.5)),
            Map.entry("LargeIncrease", trapezoidal(1.5, 1.7, 2.0, 2.0)));

    public static final LinguisticVariable SHARPEN_VARIABLE = variable(SHARPEN, 0, 100,
            Map.entry("None", trapezoidal(0, 0, 5, 15)),
            Map.entry("Low", triangular(10, 20, 35)),
            Map.entry("Medium", triangular(30, 45, 65)),
            Map.entry("High", triangular(60, 75, 90)),
            Map.entry("VeryHigh", trapezoidal(85, 92, 100, 100)));

    public static final LinguisticVariable DENOISE_VARIABLE = variable(DENOISE, 0, 100,
            Map.entry("None", trapezoidal(0, 0, 5, 15)),
            Map.entry("Low", triangular(10, 25, 40)),
            Map.entry("Medium", triangular(35, 50, 70)),
            Map.entry("High", triangular(65, 80, 95)),
            Map.entry("VeryHigh", trapezoidal(90, 95, 100, 100)));

    /** Input variables in fuzzification order. */
    public static final List<LinguisticVariable> INPUTS = List.of(
            BRIGHTNESS_VARIABLE, CONTRAST_VARIABLE, SHARPNESS_VARIABLE, NOISE_VARIABLE);

    /** Output variables in aggregation order. */
    public static final List<LinguisticVariable> OUTPUTS = List.of(
            BRIGHTNESS_ADJ_VARIABLE, CONTRAST_ADJ_VARIABLE, SHARPEN_VARIABLE, DENOISE_VARIABLE);

    private static final Map<String, LinguisticVariable> INPUTS_BY_NAME = index(INPUTS);
    private static final Map<String, LinguisticVariable> OUTPUTS_BY_NAME = index(OUTPUTS);

    public static boolean isInput(String name) {
        return INPUTS_BY_NAME.containsKey(name);
    }

    public static boolean isOutput(String name) {
        return OUTPUTS_BY_NAME.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if no input variable has this name
     */
    public static LinguisticVariable input(String name) {
        LinguisticVariable v = INPUTS_BY_NAME.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Unknown input variable: " + name);
        }
        return v;
    }

    /**
     * @throws IllegalArgumentException if no output variable has this name
     */
    public static LinguisticVariable output(String name) {
        LinguisticVariable v = OUTPUTS_BY_NAME.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Unknown output variable: " + name);
        }
        return v;
    }

    @SafeVarargs
    private static LinguisticVariable variable(String name, double min, double max,
                                               Map.Entry<String, MembershipFunction>... terms) {
        Map<String, MembershipFunction> map = new LinkedHashMap<>();
        for (Map.Entry<String, MembershipFunction> term : terms) {
            if (map.put(term.getKey(), term.getValue()) != null) {
                throw new IllegalStateException("Duplicate term " + term.getKey() + " in variable " + name);
            }
        }
        return new LinguisticVariable(name, min, max, map);
    }

    private static Map<String, LinguisticVariable> index(List<LinguisticVariable> variables) {
        Map<String, LinguisticVariable> map = new LinkedHashMap<>();
        for (LinguisticVariable v : variables) {
            map.put(v.name(), v);
        }
        return Collections.unmodifiableMap(map);
    }
}
