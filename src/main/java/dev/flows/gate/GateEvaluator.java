package dev.flows.gate;

import dev.flows.model.GateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Judges content against a gate's criteria and decides what happens next.
 *
 * <p>Content passes when the overall score reaches the threshold (inclusive) and every
 * required criterion scores at least {@link CriteriaLibrary#REQUIRED_FLOOR}. Otherwise
 * {@code onFail} picks the action:
 * <ul>
 *   <li>{@code halt}: halted</li>
 *   <li>{@code continue-with-warning}: continued-with-warning</li>
 *   <li>{@code retry}: retry while {@code attemptIndex + 1 < maxRetries}, then halted</li>
 * </ul>
 * A judge that throws counts as a failed evaluation with score 0. Evaluation never throws.
 */
public final class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    private final JudgeInvoker judge;

    public GateEvaluator(JudgeInvoker judge) {
        this.judge = judge;
    }

    public GateResult evaluate(GateConfig config, String content) {
        return evaluate(config, content, null, 0);
    }

    /**
     * @param context      original request passed to the judge; nullable
     * @param attemptIndex zero-based index of this evaluation among the gate's attempts
     */
    public GateResult evaluate(GateConfig config, String content, String context, int attemptIndex) {
        long start = System.nanoTime();
        int attempts = attemptIndex + 1;
        List<EvaluationCriterion> criteria = CriteriaLibrary.byNames(config.criteria());

        EvaluationResult evaluation;
        try {
            evaluation = judge.evaluate(config.agent(), content, criteria, context);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.toString() : e.getMessage();
            log.warn("Judge '{}' failed: {}", config.agent(), message);
            GateAction action = config.onFail() == GateConfig.OnFail.CONTINUE_WITH_WARNING
                ? GateAction.CONTINUED_WITH_WARNING : GateAction.HALTED;
            return new GateResult(false, 0, errorEvaluation(message), attempts, action,
                elapsedSince(start), message);
        }

        double score = evaluation.overallScore();
        boolean passed = score >= config.threshold()
            && CriteriaLibrary.requiredCriteriaPassed(evaluation.criteriaScores(), criteria, CriteriaLibrary.REQUIRED_FLOOR);

        GateAction action = passed ? GateAction.PASSED : failureAction(config, attemptIndex);
        log.debug("Gate judged by '{}': score={}, action={}, attempt={}",
            config.agent(), score, action.value(), attempts);
        return new GateResult(passed, score, evaluation, attempts, action, elapsedSince(start), null);
    }

    private static GateAction failureAction(GateConfig config, int attemptIndex) {
        return switch (config.onFail()) {
            case HALT -> GateAction.HALTED;
            case CONTINUE_WITH_WARNING -> GateAction.CONTINUED_WITH_WARNING;
            case RETRY -> attemptIndex + 1 < config.maxRetries() ? GateAction.RETRY : GateAction.HALTED;
        };
    }

    private static EvaluationResult errorEvaluation(String message) {
        return new EvaluationResult(0, Map.of(), false, "Evaluation failed: " + message,
            List.of("Fix the error and retry evaluation"),
            new EvaluationResult.Metadata(Instant.now(), null, null));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
