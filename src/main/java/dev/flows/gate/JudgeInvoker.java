package dev.flows.gate;

import java.util.List;

/**
 * Asks a judge agent to score content against criteria.
 */
@FunctionalInterface
public interface JudgeInvoker {

    /**
     * @param context the original request, when there is one; nullable
     */
    EvaluationResult evaluate(String agentId, String content, List<EvaluationCriterion> criteria, String context);
}
