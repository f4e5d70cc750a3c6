package dev.flows.engine;

import dev.flows.model.StepResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link FlowRunner#execute} call. {@code stepResults} is ordered as the flow
 * declares its steps.
 */
public record FlowRun(
    String flowRunId,
    boolean success,
    Map<String, StepResult> stepResults,
    String output,
    Duration duration,
    Instant startedAt,
    Instant completedAt
) {
    public FlowRun {
        stepResults = Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
    }

    public long failedCount() {
        return stepResults.values().stream().filter(r -> !r.success()).count();
    }

    public long skippedCount() {
        return stepResults.values().stream().filter(StepResult::skipped).count();
    }
}
