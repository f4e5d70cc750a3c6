package dev.flows.gate;

import dev.flows.model.GateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluate, then revise, until the content reaches the target score.
 *
 * <p>Each iteration judges the current content. The loop stops when the target is reached,
 * when an iteration after the first improves the score by less than {@code minImprovement}
 * (or lowers it, in which case the previous content is kept), when the improvement agent
 * fails, or after {@code maxIterations}.
 */
public final class FeedbackLoop {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLoop.class);

    private final GateEvaluator gateEvaluator;
    private final ImprovementAgent improvementAgent;

    public FeedbackLoop(GateEvaluator gateEvaluator, ImprovementAgent improvementAgent) {
        this.gateEvaluator = gateEvaluator;
        this.improvementAgent = improvementAgent;
    }

    public Result run(Config config, String initialContent, String originalRequest) {
        long start = System.nanoTime();
        GateConfig gate = new GateConfig(config.evaluator(), config.criteria(), config.targetScore(),
            GateConfig.OnFail.CONTINUE_WITH_WARNING, 1);
        List<Iteration> iterations = new ArrayList<>();

        String content = initialContent;
        double previousScore = 0;

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            long iterationStart = System.nanoTime();
            GateResult gateResult = gateEvaluator.evaluate(gate, content, originalRequest, 0);
            double improvement = gateResult.score() - previousScore;
            iterations.add(new Iteration(iteration, content, gateResult, improvement, elapsedSince(iterationStart)));

            if (gateResult.passed()) {
                return new Result(true, content, gateResult.score(), iteration, iterations,
                    elapsedSince(start), StopReason.TARGET_REACHED);
            }

            if (iteration > 1 && improvement < config.minImprovement()) {
                if (improvement < 0) {
                    return new Result(false, iterations.get(iterations.size() - 2).content(), previousScore,
                        iteration, iterations, elapsedSince(start), StopReason.SCORE_DEGRADED);
                }
                return new Result(false, content, gateResult.score(), iteration, iterations,
                    elapsedSince(start), StopReason.NO_IMPROVEMENT);
            }

            previousScore = gateResult.score();
            try {
                content = improvementAgent.improve(originalRequest, content, buildFeedback(gateResult, config), iteration);
            } catch (Exception e) {
                log.warn("Improvement failed at iteration {}: {}", iteration, e.getMessage());
                return new Result(false, content, gateResult.score(), iteration, iterations,
                    elapsedSince(start), StopReason.ERROR);
            }
        }

        Iteration last = iterations.get(iterations.size() - 1);
        return new Result(false, content, last.gateResult().score(), iterations.size(), iterations,
            elapsedSince(start), StopReason.MAX_ITERATIONS);
    }

    static String buildFeedback(GateResult gateResult, Config config) {
        List<String> parts = new ArrayList<>();
        parts.add("Current score: " + GateResult.percent(gateResult.score()));
        parts.add("Target score: " + GateResult.percent(config.targetScore()));
        parts.add("");

        EvaluationResult evaluation = gateResult.evaluation();
        if (!evaluation.feedback().isEmpty()) {
            parts.add("Feedback:");
            parts.add(evaluation.feedback());
            parts.add("");
        }

        parts.add("Criterion Scores:");
        for (CriterionResult result : evaluation.criteriaScores().values()) {
            parts.add("  %s %s: %s".formatted(result.passed() ? "✓" : "✗", result.name(),
                GateResult.percent(result.score())));
            if (!result.reasoning().isEmpty()) {
                parts.add("      " + result.reasoning());
            }
            if (!result.issues().isEmpty()) {
                parts.add("      Issues: " + String.join(", ", result.issues()));
            }
        }
        parts.add("");

        if (!evaluation.suggestions().isEmpty()) {
            parts.add("Suggestions for improvement:");
            evaluation.suggestions().forEach(s -> parts.add("  - " + s));
        }
        return String.join("\n", parts);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * @param evaluator judge agent id
     */
    public record Config(
        int maxIterations,
        double targetScore,
        String evaluator,
        List<String> criteria,
        double minImprovement
    ) {
        public static final int DEFAULT_MAX_ITERATIONS = 3;
        public static final double DEFAULT_TARGET_SCORE = 0.9;
        public static final double DEFAULT_MIN_IMPROVEMENT = 0.05;

        public Config {
            if (maxIterations < 1 || maxIterations > 10) {
                throw new IllegalArgumentException("maxIterations must be within [1, 10]: " + maxIterations);
            }
            if (targetScore < 0 || targetScore > 1) {
                throw new IllegalArgumentException("targetScore must be within [0, 1]: " + targetScore);
            }
            criteria = criteria == null ? List.of() : List.copyOf(criteria);
        }

        public static Config of(String evaluator, List<String> criteria) {
            return new Config(DEFAULT_MAX_ITERATIONS, DEFAULT_TARGET_SCORE, evaluator, criteria,
                DEFAULT_MIN_IMPROVEMENT);
        }
    }

    public record Iteration(int iteration, String content, GateResult gateResult, double improvement,
                            Duration duration) {}

    public record Result(
        boolean success,
        String finalContent,
        double finalScore,
        int totalIterations,
        List<Iteration> iterations,
        Duration totalDuration,
        StopReason stopReason
    ) {
        public Result {
            iterations = List.copyOf(iterations);
        }
    }

    public enum StopReason {
        TARGET_REACHED,
        MAX_ITERATIONS,
        NO_IMPROVEMENT,
        SCORE_DEGRADED,
        ERROR;

        public String value() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }
}
