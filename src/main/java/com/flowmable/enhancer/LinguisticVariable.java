package com.flowmable.enhancer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named fuzzy variable: its numeric universe and its terms.
 *
 * @param name  Variable name, e.g. "brightness"
 * @param min   Lower bound of the universe
 * @param max   Upper bound of the universe
 * @param terms Term name to membership function, in declaration order
 */
public record LinguisticVariable(
        String name,
        double min,
        double max,
        Map<String, MembershipFunction> terms
) {
    public LinguisticVariable {
        if (!(min < max)) {
            throw new IllegalArgumentException("Empty universe for " + name + ": [" + min + ", " + max + "]");
        }
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Variable " + name + " has no terms");
        }
        terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    public boolean hasTerm(String term) {
        return terms.containsKey(term);
    }

    /**
     * @throws IllegalArgumentException if the variable has no such term
     */
    public MembershipFunction term(String term) {
        MembershipFunction mf = terms.get(term);
        if (mf == null) {
            throw new IllegalArgumentException("Unknown term '" + term + "' for variable " + name);
        }
        return mf;
    }
}
