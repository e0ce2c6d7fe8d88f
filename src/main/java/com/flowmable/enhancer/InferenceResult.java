package com.flowmable.enhancer;

import java.util.List;

/**
 * Everything one inference produced, intermediate stages included, so callers
 * can explain the result.
 *
 * @param fuzzifiedInputs   Term degrees for every input variable
 * @param firedRules        Rules with non-zero strength, in rule-base order
 * @param aggregatedOutputs One curve per output variable, in registry order
 * @param parameters        Crisp enhancement parameters, always fully populated
 */
public record InferenceResult(
        FuzzifiedInputs fuzzifiedInputs,
        List<FiredRule> firedRules,
        List<AggregatedOutput> aggregatedOutputs,
        EnhancementParameters parameters
) {
    public InferenceResult {
        firedRules = List.copyOf(firedRules);
        aggregatedOutputs = List.copyOf(aggregatedOutputs);
    }

    public AggregatedOutput aggregatedOutput(String variable) {
        for (AggregatedOutput output : aggregatedOutputs) {
            if (output.variable().equals(variable)) return output;
        }
        return AggregatedOutput.empty(variable);
    }

    public List<Integer> firedRuleIds() {
        return firedRules.stream().map(f -> f.rule().id()).toList();
    }
}
