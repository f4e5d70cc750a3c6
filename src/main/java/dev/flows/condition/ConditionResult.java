package dev.flows.condition;

import java.time.Duration;

/**
 * Outcome of evaluating a step condition. A non-null {@code error} always comes with
 * {@code shouldExecute == false}.
 */
public record ConditionResult(
    boolean shouldExecute,
    String condition,
    String error, // nullable
    Duration evaluationTime
) {
    public boolean failed() {
        return error != null;
    }
}
