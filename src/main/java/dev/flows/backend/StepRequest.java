package dev.flows.backend;

import java.util.Map;

/**
 * What a single step sends to its agent.
 */
public record StepRequest(
    String userPrompt,
    Map<String, Object> context,
    String traceId,   // nullable
    String requestId  // nullable
) {
    public StepRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static StepRequest of(String userPrompt) {
        return new StepRequest(userPrompt, Map.of(), null, null);
    }
}
