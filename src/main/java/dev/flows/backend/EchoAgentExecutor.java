package dev.flows.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Deterministic executor that answers every prompt with a tagged echo. Used for dry runs and
 * for exercising flow wiring without a real agent.
 */
public final class EchoAgentExecutor implements AgentExecutor {

    private final String prefix;

    public EchoAgentExecutor() {
        this("");
    }

    public EchoAgentExecutor(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public CompletableFuture<AgentResult> run(String agentId, StepRequest request) {
        String content = "%s[%s] %s".formatted(prefix, agentId, request.userPrompt());
        return CompletableFuture.completedFuture(AgentResult.of(content));
    }
}
