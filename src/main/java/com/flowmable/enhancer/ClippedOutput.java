package com.flowmable.enhancer;

/**
 * One consequent of a fired rule: the term's membership function capped at the rule's strength.
 *
 * @param variable           Output variable name
 * @param term               Output term name
 * @param membershipFunction The term's shape
 * @param clippingLevel      Height cap, equal to the rule's firing strength (0, 1]
 */
public record ClippedOutput(
        String variable,
        String term,
        MembershipFunction membershipFunction,
        double clippingLevel
) {
    /** Clipped degree at {@code x}: min(mf(x), clippingLevel). */
    public double degreeAt(double x) {
        return Math.min(membershipFunction.evaluate(x), clippingLevel);
    }
}
