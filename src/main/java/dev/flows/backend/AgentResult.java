package dev.flows.backend;

/**
 * Structured response from an agent invocation.
 */
public record AgentResult(
    String content,
    String thought, // nullable
    String raw
) {
    public AgentResult {
        content = content == null ? "" : content;
        raw = raw == null ? content : raw;
    }

    public static AgentResult of(String content) {
        return new AgentResult(content, null, content);
    }
}
