package dev.flows.gate;

import dev.flows.backend.AgentExecutor;
import dev.flows.backend.StepRequest;

import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Asks an agent to revise content, with the original request and the judge's feedback in the
 * prompt.
 */
public final class AgentImprovementAgent implements ImprovementAgent {

    private final AgentExecutor executor;
    private final String agentId;

    public AgentImprovementAgent(AgentExecutor executor, String agentId) {
        this.executor = executor;
        this.agentId = agentId;
    }

    @Override
    public String improve(String originalRequest, String currentContent, String feedback, int iteration)
            throws Exception {
        var request = new StepRequest(buildPrompt(originalRequest, currentContent, feedback, iteration),
            Map.of("improvementMode", true, "iteration", iteration, "previousContent", currentContent),
            null, null);
        try {
            return executor.run(agentId, request).join().content();
        } catch (CompletionException e) {
            throw e.getCause() instanceof Exception cause ? cause : e;
        }
    }

    static String buildPrompt(String originalRequest, String currentContent, String feedback, int iteration) {
        return """
            You are improving a response based on evaluation feedback.

            Original Request:
            %s

            Current Response (Iteration %d):
            %s

            Evaluation Feedback:
            %s

            Please provide an improved response that addresses the feedback and improves on the weak areas.
            Focus on the criteria that scored lowest.
            Maintain the strengths while addressing the weaknesses.

            Improved Response:""".formatted(originalRequest, iteration, currentContent, feedback);
    }
}
