package com.flowmable.enhancer;

import java.util.List;

import static com.flowmable.enhancer.LinguisticVariables.*;

/**
 * The fixed, ordered table of 50 enhancement rules.
 * <p>
 * The table is validated against {@link LinguisticVariables} during class
 * initialization: a rule that names an unknown variable or term, or an id
 * that is duplicated or out of ascending order, fails the load with
 * {@link IllegalStateException}.
 */
public final class RuleBase {

    private RuleBase() {}

    public static final int RULE_COUNT = 50;

    private static final List<FuzzyRule> RULES = validate(List.of(
            // Exposure
            rule(1,
                    when(is(BRIGHTNESS, "VeryDark")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"), set(CONTRAST_ADJ, "SmallIncrease"))),
            rule(2,
                    when(is(BRIGHTNESS, "VeryDark"), is(CONTRAST, "VeryLow")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"), set(CONTRAST_ADJ, "LargeIncrease"))),
            rule(3,
                    when(is(BRIGHTNESS, "Dark")),
                    then(set(BRIGHTNESS_ADJ, "SmallIncrease"))),
            rule(4,
                    when(is(BRIGHTNESS, "Dark"), is(CONTRAST, "Low")),
                    then(set(CONTRAST_ADJ, "SmallIncrease"))),
            rule(5, "Well-exposed, medium contrast: leave brightness and contrast alone",
                    when(is(BRIGHTNESS, "Normal"), is(CONTRAST, "Medium")),
                    then(set(BRIGHTNESS_ADJ, "NoChange"), set(CONTRAST_ADJ, "NoChange"))),
            rule(6,
                    when(is(BRIGHTNESS, "Bright")),
                    then(set(BRIGHTNESS_ADJ, "SmallDecrease"))),
            rule(7,
                    when(is(BRIGHTNESS, "Bright"), is(CONTRAST, "High")),
                    then(set(CONTRAST_ADJ, "SmallDecrease"))),
            rule(8,
                    when(is(BRIGHTNESS, "VeryBright")),
                    then(set(BRIGHTNESS_ADJ, "LargeDecrease"), set(CONTRAST_ADJ, "SmallDecrease"))),
            rule(9,
                    when(is(BRIGHTNESS, "VeryBright"), is(CONTRAST, "VeryHigh")),
                    then(set(BRIGHTNESS_ADJ, "LargeDecrease"), set(CONTRAST_ADJ, "LargeDecrease"))),
            // Contrast
            rule(10,
                    when(is(CONTRAST, "VeryLow"), is(BRIGHTNESS, "Normal")),
                    then(set(CONTRAST_ADJ, "LargeIncrease"))),
            rule(11,
                    when(is(CONTRAST, "VeryLow"), is(BRIGHTNESS, "Dark")),
                    then(set(CONTRAST_ADJ, "SmallIncrease"))),
            rule(12,
                    when(is(CONTRAST, "Low")),
                    then(set(CONTRAST_ADJ, "SmallIncrease"))),
            rule(13,
                    when(is(CONTRAST, "Medium"), is(BRIGHTNESS, "Normal")),
                    then(set(CONTRAST_ADJ, "NoChange"))),
            rule(14,
                    when(is(CONTRAST, "High"), is(BRIGHTNESS, "Bright")),
                    then(set(CONTRAST_ADJ, "SmallDecrease"))),
            rule(15,
                    when(is(CONTRAST, "High")),
                    then(set(CONTRAST_ADJ, "SmallDecrease"))),
            rule(16,
                    when(is(CONTRAST, "VeryHigh")),
                    then(set(CONTRAST_ADJ, "LargeDecrease"))),
            // Sharpness against contrast and noise
            rule(17,
                    when(is(CONTRAST, "VeryLow"), is(SHARPNESS, "VeryBlurry")),
                    then(set(CONTRAST_ADJ, "LargeIncrease"), set(SHARPEN, "Medium"))),
            rule(18,
                    when(is(CONTRAST, "Low"), is(SHARPNESS, "Blurry")),
                    then(set(SHARPEN, "Low"))),
            rule(19,
                    when(is(SHARPNESS, "VeryBlurry"), is(NOISE, "Clean")),
                    then(set(SHARPEN, "VeryHigh"))),
            rule(20,
                    when(is(SHARPNESS, "VeryBlurry"), is(NOISE, "Slight")),
                    then(set(SHARPEN, "High"), set(DENOISE, "Low"))),
            rule(21,
                    when(is(SHARPNESS, "VeryBlurry"), is(NOISE, "Moderate")),
                    then(set(SHARPEN, "Medium"), set(DENOISE, "Medium"))),
            rule(22,
                    when(is(SHARPNESS, "Blurry"), is(NOISE, "Clean")),
                    then(set(SHARPEN, "High"))),
            rule(23,
                    when(is(SHARPNESS, "Blurry"), is(NOISE, "Slight")),
                    then(set(SHARPEN, "Medium"), set(DENOISE, "Low"))),
            rule(24,
                    when(is(SHARPNESS, "Blurry"), is(NOISE, "Moderate")),
                    then(set(SHARPEN, "Low"), set(DENOISE, "High"))),
            rule(25,
                    when(is(SHARPNESS, "Acceptable"), is(NOISE, "Clean")),
                    then(set(SHARPEN, "Low"))),
            rule(26,
                    when(is(SHARPNESS, "Acceptable"), is(NOISE, "Slight")),
                    then(set(SHARPEN, "None"), set(DENOISE, "Low"))),
            rule(27,
                    when(is(SHARPNESS, "Sharp")),
                    then(set(SHARPEN, "None"))),
            rule(28,
                    when(is(SHARPNESS, "VerySharp")),
                    then(set(SHARPEN, "None"))),
            rule(29,
                    when(is(SHARPNESS, "VerySharp"), is(BRIGHTNESS, "VeryDark")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"))),
            // Noise
            rule(30,
                    when(is(NOISE, "Clean")),
                    then(set(DENOISE, "None"))),
            rule(31,
                    when(is(NOISE, "Slight"), is(SHARPNESS, "Sharp")),
                    then(set(DENOISE, "Low"))),
            rule(32,
                    when(is(NOISE, "Slight"), is(SHARPNESS, "Acceptable")),
                    then(set(DENOISE, "Low"))),
            rule(33,
                    when(is(NOISE, "Slight"), is(SHARPNESS, "Blurry")),
                    then(set(DENOISE, "Medium"))),
            rule(34,
                    when(is(NOISE, "Moderate"), is(SHARPNESS, "VerySharp")),
                    then(set(DENOISE, "Medium"), set(SHARPEN, "None"))),
            rule(35,
                    when(is(NOISE, "Moderate"), is(SHARPNESS, "Sharp")),
                    then(set(DENOISE, "High"), set(SHARPEN, "None"))),
            rule(36,
                    when(is(NOISE, "Moderate")),
                    then(set(DENOISE, "High"))),
            rule(37,
                    when(is(NOISE, "Heavy"), is(SHARPNESS, "VeryBlurry")),
                    then(set(DENOISE, "VeryHigh"), set(SHARPEN, "None"))),
            rule(38,
                    when(is(NOISE, "Heavy")),
                    then(set(DENOISE, "VeryHigh"), set(SHARPEN, "None"))),
            // Combined conditions
            rule(39, "Well-balanced image: no enhancement",
                    when(is(BRIGHTNESS, "Normal"), is(CONTRAST, "Medium"), is(SHARPNESS, "Sharp"), is(NOISE, "Clean")),
                    then(set(BRIGHTNESS_ADJ, "NoChange"), set(CONTRAST_ADJ, "NoChange"), set(SHARPEN, "None"), set(DENOISE, "None"))),
            rule(40, "Dark, flat and blurry: brighten, boost contrast, sharpen",
                    when(is(BRIGHTNESS, "VeryDark"), is(CONTRAST, "VeryLow"), is(SHARPNESS, "VeryBlurry")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"), set(CONTRAST_ADJ, "LargeIncrease"), set(SHARPEN, "Medium"))),
            rule(41, "Overexposed, harsh and crisp: darken and soften contrast",
                    when(is(BRIGHTNESS, "VeryBright"), is(CONTRAST, "VeryHigh"), is(SHARPNESS, "VerySharp")),
                    then(set(BRIGHTNESS_ADJ, "LargeDecrease"), set(CONTRAST_ADJ, "LargeDecrease"), set(SHARPEN, "None"))),
            rule(42,
                    when(is(CONTRAST, "VeryLow"), is(SHARPNESS, "VeryBlurry"), is(NOISE, "Heavy")),
                    then(set(CONTRAST_ADJ, "SmallIncrease"), set(SHARPEN, "None"), set(DENOISE, "VeryHigh"))),
            rule(43,
                    when(is(BRIGHTNESS, "Dark"), is(CONTRAST, "Low"), is(NOISE, "Moderate")),
                    then(set(BRIGHTNESS_ADJ, "SmallIncrease"), set(CONTRAST_ADJ, "SmallIncrease"), set(DENOISE, "Medium"))),
            rule(44,
                    when(is(BRIGHTNESS, "Bright"), is(SHARPNESS, "Blurry"), is(NOISE, "Slight")),
                    then(set(BRIGHTNESS_ADJ, "SmallDecrease"), set(SHARPEN, "Medium"), set(DENOISE, "Low"))),
            rule(45,
                    when(is(CONTRAST, "High"), is(SHARPNESS, "VerySharp"), is(NOISE, "Clean")),
                    then(set(CONTRAST_ADJ, "SmallDecrease"), set(SHARPEN, "None"))),
            rule(46,
                    when(is(BRIGHTNESS, "VeryDark"), is(NOISE, "Heavy")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"), set(DENOISE, "VeryHigh"), set(SHARPEN, "None"))),
            rule(47,
                    when(is(BRIGHTNESS, "VeryBright"), is(CONTRAST, "VeryLow")),
                    then(set(BRIGHTNESS_ADJ, "LargeDecrease"), set(CONTRAST_ADJ, "LargeIncrease"))),
            rule(48,
                    when(is(BRIGHTNESS, "VeryDark"), is(CONTRAST, "VeryHigh")),
                    then(set(BRIGHTNESS_ADJ, "LargeIncrease"), set(CONTRAST_ADJ, "SmallDecrease"))),
            rule(49, "Heavy noise on a flat blurry image: denoise hard, never sharpen",
                    when(is(SHARPNESS, "VeryBlurry"), is(NOISE, "Heavy"), is(CONTRAST, "VeryLow")),
                    then(set(DENOISE, "VeryHigh"), set(SHARPEN, "None"), set(CONTRAST_ADJ, "SmallIncrease"))),
            rule(50,
                    when(is(BRIGHTNESS, "Normal"), is(CONTRAST, "Medium"), is(SHARPNESS, "Blurry"), is(NOISE, "Moderate")),
                    then(set(SHARPEN, "None"), set(DENOISE, "High")))
    ));

    /** All rules in id order. Immutable. */
    public static List<FuzzyRule> rules() {
        return RULES;
    }

    /**
     * Checks id order and every condition and assignment against the variable registry.
     *
     * @return the same list, unmodifiable
     * @throws IllegalStateException on the first bad reference, or an id that is
     *                               duplicated or not ascending
     */
    public static List<FuzzyRule> validate(List<FuzzyRule> rules) {
        int previousId = Integer.MIN_VALUE;
        for (FuzzyRule rule : rules) {
            if (rule.id() == previousId) {
                throw new IllegalStateException("Duplicate rule id " + rule.id());
            }
            if (rule.id() < previousId) {
                throw new IllegalStateException("Rule " + rule.id() + " listed after rule " + previousId
                        + ": rules must be in ascending id order");
            }
            previousId = rule.id();
            for (FuzzyRule.Condition condition : rule.conditions()) {
                if (!isInput(condition.variable())) {
                    throw new IllegalStateException("Rule " + rule.id() + ": unknown input variable '"
                            + condition.variable() + "'");
                }
                if (!input(condition.variable()).hasTerm(condition.term())) {
                    throw new IllegalStateException("Rule " + rule.id() + ": unknown term '"
                            + condition.term() + "' for input " + condition.variable());
                }
            }
            for (FuzzyRule.Assignment assignment : rule.assignments()) {
                if (!isOutput(assignment.variable())) {
                    throw new IllegalStateException("Rule " + rule.id() + ": unknown output variable '"
                            + assignment.variable() + "'");
                }
                if (!output(assignment.variable()).hasTerm(assignment.term())) {
                    throw new IllegalStateException("Rule " + rule.id() + ": unknown term '"
                            + assignment.term() + "' for output " + assignment.variable());
                }
            }
        }
        return List.copyOf(rules);
    }

    private static FuzzyRule rule(int id, List<FuzzyRule.Condition> conditions, List<FuzzyRule.Assignment> assignments) {
        return new FuzzyRule(id, conditions, assignments);
    }

    private static FuzzyRule rule(int id, String description,
                                  List<FuzzyRule.Condition> conditions, List<FuzzyRule.Assignment> assignments) {
        return new FuzzyRule(id, conditions, assignments, description);
    }

    private static List<FuzzyRule.Condition> when(FuzzyRule.Condition... conditions) {
        return List.of(conditions);
    }

    private static List<FuzzyRule.Assignment> then(FuzzyRule.Assignment... assignments) {
        return List.of(assignments);
    }

    private static FuzzyRule.Condition is(String variable, String term) {
        return new FuzzyRule.Condition(variable, term);
    }

    private static FuzzyRule.Assignment set(String variable, String term) {
        return new FuzzyRule.Assignment(variable, term);
    }
}
