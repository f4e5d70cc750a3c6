package dev.flows.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over agent invocation. Provider selection, transport, retries and timeouts all
 * live below this boundary; the flow runner consumes only {@link AgentResult#content()}.
 */
public interface AgentExecutor {

    /**
     * Run an agent on a prompt.
     *
     * @param agentId agent reference from the step definition
     * @param request prompt plus correlation ids
     * @return a future completing with the agent's response, or exceptionally on failure
     */
    CompletableFuture<AgentResult> run(String agentId, StepRequest request);
}
