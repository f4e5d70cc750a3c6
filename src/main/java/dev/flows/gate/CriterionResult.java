package dev.flows.gate;

import java.util.List;

/**
 * A judge's score for one criterion, in [0, 1].
 */
public record CriterionResult(String name, double score, String reasoning, List<String> issues, boolean passed) {

    public CriterionResult {
        reasoning = reasoning == null ? "" : reasoning;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /** A result whose {@code passed} flag follows {@link CriteriaLibrary#REQUIRED_FLOOR}. */
    public static CriterionResult scored(String name, double score, String reasoning, List<String> issues) {
        return new CriterionResult(name, score, reasoning, issues, score >= CriteriaLibrary.REQUIRED_FLOOR);
    }
}
