package com.flowmable.enhancer;

import java.util.List;

/**
 * Centroid (center of gravity) defuzzification.
 */
public final class Defuzzifier {

    private Defuzzifier() {}

    /**
     * Σ(x·degree) / Σ(degree) over the samples.
     * <p>
     * Samples are summed in pairs from both ends of the curve toward the middle,
     * so a curve mirrored about the centre of its universe cancels exactly:
     * mirrored brightnessAdj terms with equal clips give exactly 0.
     *
     * @return The centroid, or exactly 0 for an empty or all-zero curve
     */
    public static double centroid(AggregatedOutput output) {
        List<AggregatedOutput.Sample> samples = output.samples();
        double numerator = 0.0;
        double denominator = 0.0;
        int lo = 0;
        int hi = samples.size() - 1;
        while (lo < hi) {
            AggregatedOutput.Sample left = samples.get(lo++);
            AggregatedOutput.Sample right = samples.get(hi--);
            numerator += left.x() * left.degree() + right.x() * right.degree();
            denominator += left.degree() + right.degree();
        }
        if (lo == hi) {
            AggregatedOutput.Sample middle = samples.get(lo);
            numerator += middle.x() * middle.degree();
            denominator += middle.degree();
        }
        return denominator == 0.0 ? 0.0 : numerator / denominator;
    }
}
