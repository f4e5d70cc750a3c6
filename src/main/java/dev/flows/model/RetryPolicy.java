package dev.flows.model;

/**
 * Retry hints for the agent-invocation layer. The flow runner itself makes one attempt per step.
 */
public record RetryPolicy(int maxAttempts, long backoffMs) {
    public static final int DEFAULT_MAX_ATTEMPTS = 1;
    public static final long DEFAULT_BACKOFF_MS = 1000;

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MS);
    }
}
