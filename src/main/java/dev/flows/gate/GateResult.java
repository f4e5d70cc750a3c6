package dev.flows.gate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Outcome of one gate evaluation. {@code attempts} counts this evaluation.
 */
public record GateResult(
    boolean passed,
    double score,
    EvaluationResult evaluation,
    int attempts,
    GateAction action,
    Duration evaluationDuration,
    String error // nullable
) {

    /**
     * Render the evaluation as markdown feedback for the agent that revises the content.
     */
    public static String formatFeedbackForRetry(GateResult gateResult) {
        EvaluationResult evaluation = gateResult.evaluation();
        List<String> lines = new ArrayList<>(List.of(
            "## Quality Gate Feedback",
            "",
            "**Overall Score:** " + percent(evaluation.overallScore()),
            "**Status:** " + (gateResult.passed() ? "PASSED" : "FAILED"),
            "",
            "### Areas Needing Improvement",
            ""
        ));

        for (CriterionResult criterion : evaluation.failedCriteria()) {
            lines.add("#### %s (%s)".formatted(criterion.name(), percent(criterion.score())));
            lines.add("*" + criterion.reasoning() + "*");
            if (!criterion.issues().isEmpty()) {
                lines.add("Issues:");
                criterion.issues().forEach(issue -> lines.add("- " + issue));
            }
            lines.add("");
        }

        if (!evaluation.suggestions().isEmpty()) {
            lines.add("### Suggestions");
            evaluation.suggestions().forEach(suggestion -> lines.add("- " + suggestion));
        }
        return String.join("\n", lines);
    }

    static String percent(double score) {
        return String.format(Locale.ROOT, "%.1f%%", score * 100);
    }
}
