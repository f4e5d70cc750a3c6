package dev.flows.engine;

import dev.flows.model.StepResult;

import java.util.Map;

/**
 * A run was aborted: either the flow could not start, or failFast stopped it after a wave with
 * a failed step. Results of every step that settled before the abort are kept.
 */
public class FlowExecutionException extends FlowException {

    private final String flowRunId;
    private final String failedStepId; // nullable
    private final Map<String, StepResult> partialResults;

    public FlowExecutionException(String message, String flowRunId) {
        this(message, flowRunId, null, Map.of());
    }

    public FlowExecutionException(String message, String flowRunId, String failedStepId,
                                  Map<String, StepResult> partialResults) {
        super(message);
        this.flowRunId = flowRunId;
        this.failedStepId = failedStepId;
        this.partialResults = Map.copyOf(partialResults);
    }

    public String flowRunId() {
        return flowRunId;
    }

    public String failedStepId() {
        return failedStepId;
    }

    public Map<String, StepResult> partialResults() {
        return partialResults;
    }
}
