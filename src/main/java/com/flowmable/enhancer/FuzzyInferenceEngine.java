package com.flowmable.enhancer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Top-level entry point for metric-driven image enhancement.
 * <p>
 * PIPELINE:
 * 1. Fuzzify the four metrics against the input variables.
 * 2. Evaluate all rules (min-AND, min-implication).
 * 3. Max-aggregate clipped outputs per output variable.
 * 4. Centroid-defuzzify each non-empty curve over the neutral defaults.
 * <p>
 * Stateless: the same metrics always give an equal {@link InferenceResult}.
 */
public class FuzzyInferenceEngine {

    private final Fuzzifier fuzzifier;
    private final RuleEvaluator evaluator;
    private final Aggregator aggregator;
    private final List<FuzzyRule> rules;
    private final ImageQualityAnalyzer analyzer;

    public FuzzyInferenceEngine() {
        this(RuleBase.rules());
    }

    public FuzzyInferenceEngine(List<FuzzyRule> rules) {
        this.fuzzifier = new Fuzzifier();
        this.evaluator = new RuleEvaluator();
        this.aggregator = new Aggregator();
        this.rules = RuleBase.validate(rules);
        this.analyzer = new ImageQualityAnalyzer();
    }

    public InferenceResult infer(ImageMetrics metrics) {
        // 1. Fuzzify
        FuzzifiedInputs fuzzified = fuzzifier.fuzzify(metrics);

        // 2. Fire rules
        List<FiredRule> fired = evaluator.evaluate(rules, fuzzified);

        // 3. Aggregate
        List<AggregatedOutput> aggregated = aggregator.aggregate(fired);

        // 4. Defuzzify, keeping the neutral default where no rule spoke
        EnhancementParameters parameters = EnhancementParameters.DEFAULT;
        for (AggregatedOutput output : aggregated) {
            if (!output.isEmpty()) {
                parameters = parameters.with(output.variable(), Defuzzifier.centroid(output));
            }
        }

        return new InferenceResult(fuzzified, fired, aggregated, parameters);
    }

    public InferenceResult infer(BufferedImage image) {
        return infer(analyzer.analyze(image));
    }

    public InferenceResult infer(Path imageFile) throws IOException {
        return infer(analyzer.analyze(imageFile));
    }

    public ImageMetrics analyze(BufferedImage image) {
        return analyzer.analyze(image);
    }

    public List<FuzzyRule> rules() {
        return rules;
    }
}
