package dev.flows.engine;

import java.util.List;

/**
 * The step graph is structurally broken. Raised before any step runs.
 */
public class FlowValidationException extends FlowException {

    public enum Kind {
        UNKNOWN_DEPENDENCY,
        CYCLE_DETECTED,
        DUPLICATE_STEP
    }

    private final Kind kind;
    private final List<String> cyclePath;

    private FlowValidationException(Kind kind, String message, List<String> cyclePath) {
        super(message);
        this.kind = kind;
        this.cyclePath = List.copyOf(cyclePath);
    }

    public static FlowValidationException unknownDependency(String stepId, String dependencyId) {
        return new FlowValidationException(Kind.UNKNOWN_DEPENDENCY,
            "Dependency '%s' of step '%s' not found in step definitions".formatted(dependencyId, stepId),
            List.of());
    }

    public static FlowValidationException cycleDetected(List<String> path) {
        String message = path.isEmpty()
            ? "Cycle detected in dependency graph"
            : "Cycle detected in dependency graph: " + String.join(" -> ", path);
        return new FlowValidationException(Kind.CYCLE_DETECTED, message, path);
    }

    public static FlowValidationException duplicateStep(String stepId) {
        return new FlowValidationException(Kind.DUPLICATE_STEP,
            "Duplicate step id: " + stepId, List.of());
    }

    public Kind kind() {
        return kind;
    }

    /** Steps of the detected cycle in cycle order, first node repeated at the end. Empty otherwise. */
    public List<String> cyclePath() {
        return cyclePath;
    }
}
