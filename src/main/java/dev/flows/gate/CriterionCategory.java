package dev.flows.gate;

/**
 * Grouping of evaluation criteria.
 */
public enum CriterionCategory {
    QUALITY,
    CORRECTNESS,
    COMPLETENESS,
    SECURITY,
    STYLE,
    PERFORMANCE;

    public String value() {
        return name().toLowerCase();
    }
}
