package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.List;

/**
 * Max-aggregation of clipped rule outputs, one discretized curve per output variable.
 */
public class Aggregator {

    /** Sample intervals across a universe; the curve has SAMPLE_INTERVALS + 1 points. */
    public static final int SAMPLE_INTERVALS = 100;

    private final List<LinguisticVariable> outputs;

    public Aggregator() {
        this(LinguisticVariables.OUTPUTS);
    }

    public Aggregator(List<LinguisticVariable> outputs) {
        this.outputs = List.copyOf(outputs);
    }

    /**
     * @return One aggregated output per output variable, in registry order
     */
    public List<AggregatedOutput> aggregate(List<FiredRule> firedRules) {
        List<AggregatedOutput> result = new ArrayList<>(outputs.size());
        for (LinguisticVariable variable : outputs) {
            result.add(aggregate(variable, firedRules));
        }
        return List.copyOf(result);
    }

    public AggregatedOutput aggregate(LinguisticVariable variable, List<FiredRule> firedRules) {
        List<ClippedOutput> relevant = new ArrayList<>();
        for (FiredRule fired : firedRules) {
            for (ClippedOutput output : fired.outputs()) {
                if (output.variable().equals(variable.name())) {
                    relevant.add(output);
                }
            }
        }
        if (relevant.isEmpty()) {
            return AggregatedOutput.empty(variable.name());
        }

        double[] xs = sampleGrid(variable.min(), variable.max());
        List<AggregatedOutput.Sample> samples = new ArrayList<>(xs.length);
        for (double x : xs) {
            double degree = 0.0;
            for (ClippedOutput output : relevant) {
                degree = Math.max(degree, output.degreeAt(x));
            }
            samples.add(new AggregatedOutput.Sample(x, degree));
        }
        return new AggregatedOutput(variable.name(), samples);
    }

    /**
     * Evenly spaced points from min to max inclusive, computed by index so the
     * last point is exactly {@code max}.
     */
    public static double[] sampleGrid(double min, double max) {
        double[] xs = new double[SAMPLE_INTERVALS + 1];
        double span = max - min;
        for (int i = 0; i < SAMPLE_INTERVALS; i++) {
            xs[i] = min + i * span / SAMPLE_INTERVALS;
        }
        xs[SAMPLE_INTERVALS] = max;
        return xs;
    }
}
