package dev.flows.engine;

import java.util.Map;

/**
 * Receives the runner's structured events. Purely observational: what a logger does, or
 * whether it throws, never changes the run.
 */
@FunctionalInterface
public interface FlowEventLogger {

    FlowEventLogger NOOP = (event, payload) -> { };

    void log(String event, Map<String, Object> payload);
}
