package dev.flows.model;

/**
 * The initial request a flow runs for. Trace and request ids are nullable correlation ids.
 */
public record FlowRequest(String userPrompt, String traceId, String requestId) {

    public FlowRequest {
        userPrompt = userPrompt == null ? "" : userPrompt;
    }

    public static FlowRequest of(String userPrompt) {
        return new FlowRequest(userPrompt, null, null);
    }
}
