package dev.flows.gate;

/**
 * One thing a judge scores content on. Weights range over [0, 10]; a required criterion must
 * reach {@link CriteriaLibrary#REQUIRED_FLOOR} on its own for a gate to pass.
 */
public record EvaluationCriterion(
    String name,
    String description,
    double weight,
    boolean required,
    CriterionCategory category // nullable
) {
    public static final double DEFAULT_WEIGHT = 1.0;

    public EvaluationCriterion {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Criterion name must not be blank");
        }
        if (weight < 0 || weight > 10) {
            throw new IllegalArgumentException("Criterion weight must be within [0, 10]: " + weight);
        }
        description = description == null ? "" : description;
    }

    public static EvaluationCriterion of(String name, String description) {
        return new EvaluationCriterion(name, description, DEFAULT_WEIGHT, false, null);
    }
}
