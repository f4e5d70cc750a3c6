package dev.flows.model;

import dev.flows.backend.AgentResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one step in one run. Written once by the runner and never changed afterwards.
 */
public record StepResult(
    String stepId,
    boolean success,
    boolean skipped,
    String skipReason,  // nullable
    AgentResult result, // nullable: absent for skipped and failed steps
    String error,       // nullable
    Duration duration,
    Instant startedAt,
    Instant completedAt
) {
    public static StepResult succeeded(String stepId, AgentResult result, Instant startedAt, Instant completedAt) {
        return new StepResult(stepId, true, false, null, result, null,
            Duration.between(startedAt, completedAt), startedAt, completedAt);
    }

    public static StepResult failed(String stepId, String error, Instant startedAt, Instant completedAt) {
        return new StepResult(stepId, false, false, null, null, error,
            Duration.between(startedAt, completedAt), startedAt, completedAt);
    }

    /** Skipped steps count as successful. */
    public static StepResult skipped(String stepId, String reason, Instant startedAt, Instant completedAt) {
        return new StepResult(stepId, true, true, reason, null, null,
            Duration.between(startedAt, completedAt), startedAt, completedAt);
    }

    /** Content produced by the agent, or null when the step produced none. */
    public String content() {
        return result == null ? null : result.content();
    }

    public boolean hasContent() {
        return result != null;
    }
}
