package dev.flows.gate;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the prompt sent to a judge agent: the content, the criteria with their weights, and
 * the JSON shape the judge must answer in.
 */
public final class EvaluationPromptBuilder {

    private static final String RESPONSE_FORMAT = """
        ### Instructions

        Evaluate the content against each criterion above. For each criterion:
        1. Assign a score from 0.0 to 1.0
        2. Provide brief reasoning (1-2 sentences)
        3. List specific issues found (if any)

        Then provide an overall assessment.

        ### Required Output Format

        Respond with valid JSON only:

        ```json
        {
          "overallScore": 0.85,
          "criteriaScores": {
            "criterion_name": {
              "name": "criterion_name",
              "score": 0.9,
              "reasoning": "Brief explanation",
              "issues": ["issue 1", "issue 2"],
              "passed": true
            }
          },
          "pass": true,
          "feedback": "Overall assessment summary",
          "suggestions": ["suggestion 1", "suggestion 2"]
        }
        ```""";

    private EvaluationPromptBuilder() {}

    /**
     * @param context original request shown to the judge; nullable
     */
    public static String build(String content, List<EvaluationCriterion> criteria, String context) {
        var sb = new StringBuilder();
        sb.append("## Evaluation Request\n\n");
        if (context != null && !context.isEmpty()) {
            sb.append("### Context\n").append(context).append("\n\n");
        }
        sb.append("### Content to Evaluate\n\n```\n").append(content).append("\n```\n\n");
        sb.append("### Evaluation Criteria\n\n").append(criteriaList(criteria)).append("\n\n");
        sb.append(RESPONSE_FORMAT);
        return sb.toString();
    }

    private static String criteriaList(List<EvaluationCriterion> criteria) {
        return IntStream.range(0, criteria.size())
            .mapToObj(i -> {
                EvaluationCriterion c = criteria.get(i);
                return "%d. **%s** (weight: %s%s)\n   %s".formatted(
                    i + 1, c.name(), weight(c.weight()), c.required() ? ", REQUIRED" : "", c.description());
            })
            .collect(Collectors.joining("\n\n"));
    }

    private static String weight(double weight) {
        return weight == Math.rint(weight) ? Long.toString((long) weight) : Double.toString(weight);
    }
}
