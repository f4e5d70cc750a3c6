package dev.flows.gate;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedbackLoopTest {

    private final List<String> judged = new ArrayList<>();
    private final List<String> feedbackSeen = new ArrayList<>();

    private GateEvaluator judgeScoring(Double... scores) {
        Deque<Double> queue = new ArrayDeque<>(List.of(scores));
        return new GateEvaluator((agentId, content, criteria, context) -> {
            judged.add(content);
            return new EvaluationResult(queue.removeFirst(), Map.of(), false, "Needs work",
                List.of("Add examples"), null);
        });
    }

    private ImprovementAgent versioning() {
        return (originalRequest, currentContent, feedback, iteration) -> {
            feedbackSeen.add(feedback);
            return "v" + iteration;
        };
    }

    private static FeedbackLoop.Config config(int maxIterations) {
        return new FeedbackLoop.Config(maxIterations, 0.9, "judge", List.of(), 0.05);
    }

    @Test
    void stopsWhenTargetIsReached() {
        var loop = new FeedbackLoop(judgeScoring(0.5, 0.95), versioning());

        FeedbackLoop.Result result = loop.run(config(3), "draft", "Write docs");

        assertThat(result.success()).isTrue();
        assertThat(result.stopReason()).isEqualTo(FeedbackLoop.StopReason.TARGET_REACHED);
        assertThat(result.finalContent()).isEqualTo("v1");
        assertThat(result.finalScore()).isEqualTo(0.95);
        assertThat(result.totalIterations()).isEqualTo(2);
        assertThat(judged).containsExactly("draft", "v1");
        assertThat(feedbackSeen.get(0)).contains("Current score: 50.0%", "Target score: 90.0%",
            "Feedback:\nNeeds work", "  - Add examples");
    }

    @Test
    void stopsWhenImprovementIsTooSmall() {
        var loop = new FeedbackLoop(judgeScoring(0.5, 0.52), versioning());

        FeedbackLoop.Result result = loop.run(config(5), "draft", "Write docs");

        assertThat(result.success()).isFalse();
        assertThat(result.stopReason()).isEqualTo(FeedbackLoop.StopReason.NO_IMPROVEMENT);
        assertThat(result.finalContent()).isEqualTo("v1");
        assertThat(result.finalScore()).isEqualTo(0.52);
    }

    @Test
    void degradedScoreKeepsPreviousContent() {
        var loop = new FeedbackLoop(judgeScoring(0.6, 0.4), versioning());

        FeedbackLoop.Result result = loop.run(config(5), "draft", "Write docs");

        assertThat(result.stopReason()).isEqualTo(FeedbackLoop.StopReason.SCORE_DEGRADED);
        assertThat(result.finalContent()).isEqualTo("draft");
        assertThat(result.finalScore()).isEqualTo(0.6);
        assertThat(result.iterations()).hasSize(2);
    }

    @Test
    void stopsAfterMaxIterations() {
        var loop = new FeedbackLoop(judgeScoring(0.3, 0.5, 0.7), versioning());

        FeedbackLoop.Result result = loop.run(config(3), "draft", "Write docs");

        assertThat(result.stopReason()).isEqualTo(FeedbackLoop.StopReason.MAX_ITERATIONS);
        assertThat(result.totalIterations()).isEqualTo(3);
        assertThat(result.finalScore()).isEqualTo(0.7);
        assertThat(result.iterations()).extracting(FeedbackLoop.Iteration::content)
            .containsExactly("draft", "v1", "v2");
    }

    @Test
    void improvementFailureStopsTheLoop() {
        ImprovementAgent broken = (originalRequest, currentContent, feedback, iteration) -> {
            throw new IllegalStateException("agent unavailable");
        };
        var loop = new FeedbackLoop(judgeScoring(0.5), broken);

        FeedbackLoop.Result result = loop.run(config(3), "draft", "Write docs");

        assertThat(result.stopReason()).isEqualTo(FeedbackLoop.StopReason.ERROR);
        assertThat(result.finalContent()).isEqualTo("draft");
        assertThat(result.stopReason().value()).isEqualTo("error");
    }

    @Test
    void configRangesAreChecked() {
        assertThatThrownBy(() -> new FeedbackLoop.Config(11, 0.9, "judge", List.of(), 0.05))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeedbackLoop.Config(3, 1.2, "judge", List.of(), 0.05))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(FeedbackLoop.Config.of("judge", List.of("clarity")).maxIterations()).isEqualTo(3);
    }

    @Test
    void improvementPromptCarriesRequestContentAndFeedback() {
        String prompt = AgentImprovementAgent.buildPrompt("Write docs", "draft", "Too short", 2);

        assertThat(prompt).contains("Original Request:\nWrite docs", "Current Response (Iteration 2):\ndraft",
            "Evaluation Feedback:\nToo short");
        assertThat(prompt).endsWith("Improved Response:");
    }
}
