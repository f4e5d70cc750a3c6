package dev.flows.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JudgeResponseParserTest {

    private static final List<EvaluationCriterion> CRITERIA = List.of(CriteriaLibrary.ACCURACY, CriteriaLibrary.CLARITY);

    @Test
    void parsesFencedJsonWithNestedCriteria() {
        String response = """
            Here is my evaluation:

            ```json
            {
              "overallScore": 0.1,
              "criteriaScores": {
                "accuracy": {"score": 0.9, "reasoning": "Facts check out", "issues": []},
                "clarity": {"score": 0.6, "reason": "Dense", "issues": ["long sentences"]}
              },
              "feedback": "Solid but dense",
              "suggestions": ["Split paragraphs"]
            }
            ```
            """;

        EvaluationResult result = JudgeResponseParser.parse(response, CRITERIA);

        // (0.9 * 2.0 + 0.6 * 1.0) / 3.0, the judge's own overallScore is not trusted
        assertThat(result.overallScore()).isCloseTo(0.8, within(1e-9));
        assertThat(result.pass()).isTrue();
        assertThat(result.criteriaScores().get("accuracy").reasoning()).isEqualTo("Facts check out");
        assertThat(result.criteriaScores().get("clarity").reasoning()).isEqualTo("Dense");
        assertThat(result.criteriaScores().get("clarity").issues()).containsExactly("long sentences");
        assertThat(result.criteriaScores().get("clarity").passed()).isFalse();
        assertThat(result.feedback()).isEqualTo("Solid but dense");
        assertThat(result.suggestions()).containsExactly("Split paragraphs");
    }

    @Test
    void readsFlatAndTopLevelScoreShapes() {
        EvaluationResult flat = JudgeResponseParser.parse(
            "{\"scores\": {\"accuracy\": 80, \"clarity\": \"0.5 overall\"}, \"summary\": \"ok\"}", CRITERIA);
        assertThat(flat.criteriaScores().get("accuracy").score()).isEqualTo(0.8);
        assertThat(flat.criteriaScores().get("clarity").score()).isEqualTo(0.5);
        assertThat(flat.feedback()).isEqualTo("ok");

        EvaluationResult top = JudgeResponseParser.parse(
            "{\"accuracy\": {\"value\": 0.7}, \"clarity\": 1}", CRITERIA);
        assertThat(top.criteriaScores().get("accuracy").score()).isEqualTo(0.7);
        assertThat(top.criteriaScores().get("clarity").score()).isEqualTo(1.0);
    }

    @Test
    void missingCriterionScoresZero() {
        EvaluationResult result = JudgeResponseParser.parse("{\"accuracy\": 1.0}", CRITERIA);

        CriterionResult clarity = result.criteriaScores().get("clarity");
        assertThat(clarity.score()).isZero();
        assertThat(clarity.passed()).isFalse();
        assertThat(clarity.issues()).containsExactly("Criterion score not found in response");
    }

    @Test
    void repairsSloppyJson() {
        String response = "Result: {accuracy: 0.9, clarity: 0.8, 'feedback': 'fine',}";

        EvaluationResult result = JudgeResponseParser.parse(response, CRITERIA);

        assertThat(result.criteriaScores().get("accuracy").score()).isEqualTo(0.9);
        assertThat(result.feedback()).isEqualTo("fine");
    }

    @Test
    void fallsBackToScoresInProse() {
        String response = """
            Accuracy: 0.9. The dates are right.
            Clarity - 40%
            """;

        EvaluationResult result = JudgeResponseParser.parse(response, CRITERIA);

        assertThat(result.criteriaScores().get("accuracy").score()).isEqualTo(0.9);
        assertThat(result.criteriaScores().get("clarity").score()).isEqualTo(0.4);
        assertThat(result.feedback()).isEqualTo("Evaluation extracted heuristically from response");
    }

    @Test
    void overallScoreIsUsedWhenThereAreNoCriteria() {
        EvaluationResult result = JudgeResponseParser.parse("{\"overallScore\": 92}", List.of());

        assertThat(result.overallScore()).isEqualTo(0.92);
        assertThat(result.criteriaScores()).isEmpty();
    }

    @Test
    void normalizesScores() {
        var json = JsonNodeFactory.instance;
        assertThat(JudgeResponseParser.normalizeScore(0.42)).isEqualTo(0.42);
        assertThat(JudgeResponseParser.normalizeScore(85)).isEqualTo(0.85);
        assertThat(JudgeResponseParser.normalizeScore(250)).isEqualTo(1.0);
        assertThat(JudgeResponseParser.normalizeScore(-3)).isZero();
        assertThat(JudgeResponseParser.normalizeScore("7.5/10")).isEqualTo(0.075);
        assertThat(JudgeResponseParser.normalizeScore("n/a")).isZero();
        assertThat(JudgeResponseParser.normalizeScore(json.booleanNode(true))).isZero();
        assertThat(JudgeResponseParser.normalizeScore((JsonNode) null)).isZero();
    }

    @Test
    void extractsFencedBlockBeforeBareObject() {
        assertThat(JudgeResponseParser.extractJson("x {\"a\":1} ```json\n{\"b\":2}\n```")).isEqualTo("{\"b\":2}");
        assertThat(JudgeResponseParser.extractJson("no json here")).isNull();
    }
}
