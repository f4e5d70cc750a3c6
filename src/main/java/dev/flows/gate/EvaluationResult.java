package dev.flows.gate;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A judge's verdict on a piece of content.
 */
public record EvaluationResult(
    double overallScore,
    Map<String, CriterionResult> criteriaScores,
    boolean pass,
    String feedback,
    List<String> suggestions,
    Metadata metadata
) {
    public EvaluationResult {
        criteriaScores = criteriaScores == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(criteriaScores));
        feedback = feedback == null ? "" : feedback;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        metadata = metadata == null ? new Metadata(Instant.now(), null, null) : metadata;
    }

    /** Criteria the judge did not pass, in the judge's order. */
    public List<CriterionResult> failedCriteria() {
        return criteriaScores.values().stream().filter(r -> !r.passed()).toList();
    }

    public EvaluationResult withMetadata(Metadata metadata) {
        return new EvaluationResult(overallScore, criteriaScores, pass, feedback, suggestions, metadata);
    }

    /**
     * @param evaluatorAgent     nullable
     * @param evaluationDuration nullable
     */
    public record Metadata(Instant evaluatedAt, String evaluatorAgent, Duration evaluationDuration) {}
}
