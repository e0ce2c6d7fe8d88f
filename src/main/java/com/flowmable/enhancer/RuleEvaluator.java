package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Mamdani rule evaluation: min for AND, min (clipping) for implication.
 */
public class RuleEvaluator {

    /**
     * Evaluate every rule in ascending id order and keep those that fired.
     *
     * @param rules  Rules, in any order
     * @param inputs Fuzzified metrics
     * @return Fired rules in ascending id order
     */
    public List<FiredRule> evaluate(List<FuzzyRule> rules, FuzzifiedInputs inputs) {
        List<FuzzyRule> ordered = rules.stream()
                .sorted(Comparator.comparingInt(FuzzyRule::id))
                .toList();
        List<FiredRule> fired = new ArrayList<>();
        for (FuzzyRule rule : ordered) {
            double strength = firingStrength(rule, inputs);
            if (strength > 0) {
                fired.add(new FiredRule(rule, strength, clip(rule, strength)));
            }
        }
        return List.copyOf(fired);
    }

    /**
     * Minimum over the antecedent degrees. A condition naming an absent variable or term counts as 0.
     */
    public double firingStrength(FuzzyRule rule, FuzzifiedInputs inputs) {
        double strength = 1.0;
        for (FuzzyRule.Condition condition : rule.conditions()) {
            strength = Math.min(strength, inputs.degree(condition.variable(), condition.term()));
        }
        return strength;
    }

    private List<ClippedOutput> clip(FuzzyRule rule, double strength) {
        List<ClippedOutput> outputs = new ArrayList<>(rule.assignments().size());
        for (FuzzyRule.Assignment assignment : rule.assignments()) {
            MembershipFunction mf = LinguisticVariables.output(assignment.variable()).term(assignment.term());
            outputs.add(new ClippedOutput(assignment.variable(), assignment.term(), mf, strength));
        }
        return outputs;
    }
}
