package dev.flows.model;

/**
 * Run-wide execution settings. The timeout is advisory; nothing in the engine enforces it.
 */
public record FlowSettings(
    int maxParallelism,
    boolean failFast,
    Long timeoutMs // nullable
) {
    public static final int DEFAULT_MAX_PARALLELISM = 3;
    public static final boolean DEFAULT_FAIL_FAST = true;

    public static FlowSettings defaults() {
        return new FlowSettings(DEFAULT_MAX_PARALLELISM, DEFAULT_FAIL_FAST, null);
    }

    public FlowSettings withMaxParallelism(int value) {
        return new FlowSettings(value, failFast, timeoutMs);
    }

    public FlowSettings withFailFast(boolean value) {
        return new FlowSettings(maxParallelism, value, timeoutMs);
    }
}
