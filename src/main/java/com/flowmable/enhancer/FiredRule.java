package com.flowmable.enhancer;

import java.util.List;

/**
 * A rule whose antecedent was satisfied to a non-zero degree.
 *
 * @param rule           The source rule
 * @param firingStrength Min of the antecedent degrees, in (0, 1]
 * @param outputs        One clipped output per assignment, in rule order
 */
public record FiredRule(
        FuzzyRule rule,
        double firingStrength,
        List<ClippedOutput> outputs
) {
    public FiredRule {
        outputs = List.copyOf(outputs);
    }
}
