package dev.flows.gate;

import dev.flows.backend.AgentExecutor;
import dev.flows.backend.AgentResult;
import dev.flows.backend.StepRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Runs a judge agent through an {@link AgentExecutor} and parses its answer.
 */
public final class JudgeEvaluator implements JudgeInvoker {

    private static final Logger log = LoggerFactory.getLogger(JudgeEvaluator.class);

    private final AgentExecutor executor;

    public JudgeEvaluator(AgentExecutor executor) {
        this.executor = executor;
    }

    @Override
    public EvaluationResult evaluate(String agentId, String content, List<EvaluationCriterion> criteria, String context) {
        long start = System.nanoTime();
        String prompt = EvaluationPromptBuilder.build(content, criteria, context);
        var request = new StepRequest(prompt, Map.of(
            "evaluationMode", true,
            "expectedResponseFormat", "json",
            "criteria", criteria.stream().map(EvaluationCriterion::name).toList()
        ), null, null);

        AgentResult response;
        try {
            response = executor.run(agentId, request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IllegalStateException("Judge agent '%s' failed: %s".formatted(agentId, cause.getMessage()), cause);
        }

        EvaluationResult result = JudgeResponseParser.parse(response.content(), criteria);
        log.debug("Judge '{}' scored {} criteria, overall {}", agentId, result.criteriaScores().size(),
            result.overallScore());
        return result.withMetadata(new EvaluationResult.Metadata(
            result.metadata().evaluatedAt(), agentId, Duration.ofNanos(System.nanoTime() - start)));
    }
}
