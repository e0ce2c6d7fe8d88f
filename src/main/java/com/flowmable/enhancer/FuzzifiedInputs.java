package com.flowmable.enhancer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Degree of membership of every term of every input variable for one set of metrics.
 *
 * @param degrees Variable name to (term name to degree), in registry order
 */
public record FuzzifiedInputs(Map<String, Map<String, Double>> degrees) {

    public FuzzifiedInputs {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        degrees.forEach((variable, terms) ->
                copy.put(variable, Collections.unmodifiableMap(new LinkedHashMap<>(terms))));
        degrees = Collections.unmodifiableMap(copy);
    }

    /**
     * Degree for a variable/term pair; 0 when either is absent.
     */
    public double degree(String variable, String term) {
        Map<String, Double> terms = degrees.get(variable);
        if (terms == null) return 0.0;
        Double value = terms.get(term);
        return value == null ? 0.0 : value;
    }

    /** Term degrees for one variable, empty when the variable is absent. */
    public Map<String, Double> termsOf(String variable) {
        return degrees.getOrDefault(variable, Map.of());
    }
}
