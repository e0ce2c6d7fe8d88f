package com.flowmable.enhancer;

import java.util.List;

/**
 * Discretized fuzzy set for one output variable after max-aggregation.
 * <p>
 * An empty sample list means no fired rule addressed the variable.
 *
 * @param variable Output variable name
 * @param samples  (x, degree) pairs spanning the universe, ascending x
 */
public record AggregatedOutput(String variable, List<Sample> samples) {

    public record Sample(double x, double degree) {}

    public AggregatedOutput {
        samples = List.copyOf(samples);
    }

    public static AggregatedOutput empty(String variable) {
        return new AggregatedOutput(variable, List.of());
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double maxDegree() {
        double max = 0.0;
        for (Sample s : samples) {
            max = Math.max(max, s.degree());
        }
        return max;
    }
}
