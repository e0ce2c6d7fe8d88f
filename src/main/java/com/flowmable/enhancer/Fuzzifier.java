package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts crisp metrics into term degrees for every input variable.
 */
public class Fuzzifier {

    private final List<LinguisticVariable> inputs;

    public Fuzzifier() {
        this(LinguisticVariables.INPUTS);
    }

    public Fuzzifier(List<LinguisticVariable> inputs) {
        this.inputs = List.copyOf(inputs);
    }

    public FuzzifiedInputs fuzzify(ImageMetrics metrics) {
        Map<String, Map<String, Double>> degrees = new LinkedHashMap<>();
        for (LinguisticVariable variable : inputs) {
            double x = metrics.valueOf(variable.name());
            Map<String, Double> terms = new LinkedHashMap<>();
            variable.terms().forEach((term, mf) -> terms.put(term, mf.evaluate(x)));
            degrees.put(variable.name(), terms);
        }
        return new FuzzifiedInputs(degrees);
    }
}
