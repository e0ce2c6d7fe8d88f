package com.flowmable.enhancer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunctive IF/THEN rule: every condition ANDed, every assignment asserted.
 *
 * @param id          Stable rule number, evaluation order
 * @param conditions  Antecedent (input variable, term) pairs
 * @param assignments Consequent (output variable, term) pairs
 * @param description Human-readable text; derived from the conditions when absent
 */
public record FuzzyRule(
        int id,
        List<Condition> conditions,
        List<Assignment> assignments,
        String description
) {
    public record Condition(String variable, String term) {
        @Override
        public String toString() {
            return variable + " is " + term;
        }
    }

    public record Assignment(String variable, String term) {
        @Override
        public String toString() {
            return variable + " is " + term;
        }
    }

    public FuzzyRule {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " has no conditions");
        }
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " has no assignments");
        }
        conditions = List.copyOf(conditions);
        assignments = List.copyOf(assignments);
        if (description == null || description.isBlank()) {
            description = describe(conditions, assignments);
        }
    }

    public FuzzyRule(int id, List<Condition> conditions, List<Assignment> assignments) {
        this(id, conditions, assignments, null);
    }

    private static String describe(List<Condition> conditions, List<Assignment> assignments) {
        return "IF " + conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND "))
                + " THEN " + assignments.stream().map(Assignment::toString).collect(Collectors.joining(", "));
    }
}
