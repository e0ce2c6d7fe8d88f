package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns inference artifacts into data a report or chart can show directly.
 */
public class InferenceExplainer {

    /**
     * Sampled shape of one term over its variable's universe.
     *
     * @param term    Term name
     * @param samples (x, degree) pairs on the same grid the aggregator uses
     */
    public record MembershipCurve(String term, List<AggregatedOutput.Sample> samples) {}

    /**
     * One rule's evaluation, with the degree each of its conditions contributed.
     */
    public record RuleActivation(
            int ruleId,
            String description,
            double firingStrength,
            boolean active,
            List<AntecedentDegree> antecedents,
            List<FuzzyRule.Assignment> consequents
    ) {}

    public record AntecedentDegree(String variable, String term, double degree) {}

    public List<MembershipCurve> membershipCurves(LinguisticVariable variable) {
        double[] xs = Aggregator.sampleGrid(variable.min(), variable.max());
        List<MembershipCurve> curves = new ArrayList<>();
        variable.terms().forEach((term, mf) -> {
            List<AggregatedOutput.Sample> samples = new ArrayList<>(xs.length);
            for (double x : xs) {
                samples.add(new AggregatedOutput.Sample(x, mf.evaluate(x)));
            }
            curves.add(new MembershipCurve(term, List.copyOf(samples)));
        });
        return curves;
    }

    /**
     * One activation per rule in {@code rules}, fired or not. Rules that did not
     * fire report strength 0 and {@code active == false}.
     *
     * @param rules  The rule list the engine ran, usually {@link FuzzyInferenceEngine#rules()}
     * @param result The inference to explain
     */
    public List<RuleActivation> ruleActivations(List<FuzzyRule> rules, InferenceResult result) {
        Map<Integer, Double> strengths = new HashMap<>();
        for (FiredRule fired : result.firedRules()) {
            strengths.put(fired.rule().id(), fired.firingStrength());
        }

        List<RuleActivation> activations = new ArrayList<>(rules.size());
        for (FuzzyRule rule : rules) {
            double strength = strengths.getOrDefault(rule.id(), 0.0);
            List<AntecedentDegree> antecedents = rule.conditions().stream()
                    .map(c -> new AntecedentDegree(c.variable(), c.term(),
                            result.fuzzifiedInputs().degree(c.variable(), c.term())))
                    .toList();
            activations.add(new RuleActivation(
                    rule.id(),
                    rule.description(),
                    strength,
                    strength > 0,
                    antecedents,
                    rule.assignments()));
        }
        return activations;
    }

    /**
     * Plain-language summary of the metrics, e.g. "Image is dark, low contrast, blurry, clean."
     */
    public String interpret(ImageMetrics m) {
        List<String> parts = new ArrayList<>(4);

        if (m.brightness() < 60) parts.add("dark");
        else if (m.brightness() > 200) parts.add("very bright");
        else if (m.brightness() > 160) parts.add("bright");
        else parts.add("normal brightness");

        if (m.contrast() < 20) parts.add("very low contrast");
        else if (m.contrast() < 40) parts.add("low contrast");
        else if (m.contrast() > 85) parts.add("very high contrast");
        else if (m.contrast() > 70) parts.add("high contrast");
        else parts.add("medium contrast");

        if (m.sharpness() < 25) parts.add("very blurry");
        else if (m.sharpness() < 45) parts.add("blurry");
        else if (m.sharpness() > 85) parts.add("very sharp");
        else if (m.sharpness() > 65) parts.add("sharp");
        else parts.add("acceptable sharpness");

        if (m.noise() > 75) parts.add("heavy noise");
        else if (m.noise() > 45) parts.add("moderate noise");
        else if (m.noise() > 20) parts.add("slight noise");
        else parts.add("clean");

        return "Image is " + String.join(", ", parts) + ".";
    }

    public List<String> recommendedActions(EnhancementParameters p) {
        List<String> actions = new ArrayList<>();

        if (Math.abs(p.brightnessAdj()) > 20) {
            actions.add(String.format(Locale.ROOT, "%s brightness by %.1f units",
                    p.brightnessAdj() > 0 ? "Increase" : "Decrease", Math.abs(p.brightnessAdj())));
        }
        if (Math.abs(p.contrastAdj() - 1) > 0.1) {
            actions.add(String.format(Locale.ROOT, "%s contrast by %.0f%%",
                    p.contrastAdj() > 1 ? "Increase" : "Decrease", Math.abs(p.contrastAdj() - 1) * 100));
        }
        if (p.sharpen() > 10) {
            actions.add(String.format(Locale.ROOT, "Apply %.0f%% sharpening", p.sharpen()));
        }
        if (p.denoise() > 10) {
            actions.add(String.format(Locale.ROOT, "Apply %.0f%% noise reduction", p.denoise()));
        }

        if (actions.isEmpty()) {
            actions.add("No enhancement needed - image quality is already good");
        }
        return actions;
    }
}
