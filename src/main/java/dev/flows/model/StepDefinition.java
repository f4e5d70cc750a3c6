package dev.flows.model;

import java.util.List;

/**
 * A step is one agent invocation (or gate, branch or consensus variant) with declared
 * dependencies and input sourcing.
 */
public record StepDefinition(
    String id,
    String name,
    String agent,
    List<String> dependsOn,
    StepInput input,
    String condition, // nullable: step always runs when absent
    Long timeoutMs,   // nullable: advisory
    RetryPolicy retry,
    StepKind kind
) {
    public StepDefinition {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        input = input == null ? StepInput.fromRequest() : input;
        retry = retry == null ? RetryPolicy.defaults() : retry;
        kind = kind == null ? new StepKind.Agent() : kind;
    }

    public StepType type() {
        return kind.type();
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
