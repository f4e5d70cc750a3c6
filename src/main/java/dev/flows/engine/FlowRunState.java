package dev.flows.engine;

import dev.flows.model.FlowDefinition;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state for one flow run. Steps of the same wave record their results concurrently,
 * each under its own key and exactly once.
 */
public final class FlowRunState {
    private final String runId;
    private final FlowDefinition flow;
    private final Instant startedAt;
    private final Map<String, StepResult> results = new ConcurrentHashMap<>();
    private final AtomicInteger waveCount = new AtomicInteger();

    public FlowRunState(FlowDefinition flow) {
        this(UUID.randomUUID().toString(), flow, Instant.now());
    }

    FlowRunState(String runId, FlowDefinition flow, Instant startedAt) {
        this.runId = runId;
        this.flow = flow;
        this.startedAt = startedAt;
    }

    public String runId() { return runId; }
    public FlowDefinition flow() { return flow; }
    public Instant startedAt() { return startedAt; }
    public int waveCount() { return waveCount.get(); }

    /** Advance to the next wave and return its zero-based index. */
    public int nextWave() {
        return waveCount.getAndIncrement();
    }

    /**
     * Record the result of a step.
     *
     * @throws IllegalStateException if the step already has a result in this run
     */
    public void record(StepResult result) {
        StepResult previous = results.putIfAbsent(result.stepId(), result);
        if (previous != null) {
            throw new IllegalStateException("Step '" + result.stepId() + "' already has a result in run " + runId);
        }
    }

    public StepResult result(String stepId) {
        return results.get(stepId);
    }

    public boolean hasResult(String stepId) {
        return results.containsKey(stepId);
    }

    /** Point-in-time copy of the results recorded so far. */
    public Map<String, StepResult> snapshot() {
        return Map.copyOf(results);
    }

    /** Results recorded so far, in the order the flow declares its steps. */
    public Map<String, StepResult> orderedResults() {
        var ordered = new LinkedHashMap<String, StepResult>();
        for (StepDefinition step : flow.steps()) {
            StepResult result = results.get(step.id());
            if (result != null) {
                ordered.put(step.id(), result);
            }
        }
        return ordered;
    }

    public boolean allSucceeded() {
        return results.values().stream().allMatch(StepResult::success);
    }
}
