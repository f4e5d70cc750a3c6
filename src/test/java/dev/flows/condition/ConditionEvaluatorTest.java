package dev.flows.condition;

import dev.flows.backend.AgentResult;
import dev.flows.model.FlowDefinition;
import dev.flows.model.FlowRequest;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final ConditionContext context = evaluator.buildContext(results(),
        new FlowRequest("Review PR 42 please", "trace-7", null),
        new FlowDefinition("review", "Review", null, "3.0.0", List.of(), null, null));

    @Test
    void blankConditionAlwaysRuns() {
        assertThat(evaluator.evaluate(null, context).shouldExecute()).isTrue();
        assertThat(evaluator.evaluate("   ", context).shouldExecute()).isTrue();
    }

    @Test
    void readsStepResultFields() {
        assertThat(run("results.analyze.success")).isTrue();
        assertThat(run("results.lint.success")).isFalse();
        assertThat(run("results.lint.error === 'linter crashed'")).isTrue();
        assertThat(run("results.docs.skipped")).isTrue();
        assertThat(run("results.analyze.skipped")).isFalse();
        assertThat(run("results.analyze.content.includes('LGTM')")).isTrue();
        assertThat(run("results.analyze.duration >= 0")).isTrue();
    }

    @Test
    void readsParsedJsonContent() {
        assertThat(run("results.scan.data.severity === 'high'")).isTrue();
        assertThat(run("results.scan.data.findings.length > 1")).isTrue();
        assertThat(run("results.scan.data.findings.some(f => f.score >= 9)")).isTrue();
        assertThat(run("results.scan.data.findings.every(f => f.score > 5)")).isFalse();
        assertThat(run("results.scan.data.findings.filter(f => f.score > 5).length === 1")).isTrue();
        assertThat(run("results.scan.data.tags.includes('sql')")).isTrue();
        assertThat(run("results.scan.data['severity'] == 'high'")).isTrue();
        assertThat(run("results.analyze.data === undefined")).isTrue();
    }

    @Test
    void readsRequestAndFlowMetadata() {
        assertThat(run("request.userPrompt.toLowerCase().startsWith('review')")).isTrue();
        assertThat(run("request.traceId === 'trace-7'")).isTrue();
        assertThat(run("request.requestId === undefined")).isTrue();
        assertThat(run("flow.id === 'review' && flow.version === '3.0.0'")).isTrue();
    }

    @Test
    void caseMappingIgnoresTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(run("'TITLE'.toLowerCase() === 'title'")).isTrue();
            assertThat(run("'title'.toUpperCase() === 'TITLE'")).isTrue();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void followsJavaScriptOperatorSemantics() {
        assertThat(run("1 + 2 * 3 === 7")).isTrue();
        assertThat(run("'1' == 1")).isTrue();
        assertThat(run("'1' === 1")).isFalse();
        assertThat(run("null == undefined")).isTrue();
        assertThat(run("!''")).isTrue();
        assertThat(run("0 || 'fallback'")).isTrue();
        assertThat(run("(results.lint.success ? 1 : 0) === 0")).isTrue();
        assertThat(run("[1, 2, 3].includes(2)")).isTrue();
        assertThat(run("'b' > 'a'")).isTrue();
        assertThat(run("10 % 4 === 2 && -(-1) === 1")).isTrue();
    }

    @Test
    void optionalChainingOnMissingStep() {
        assertThat(run("results.missing?.success === undefined")).isTrue();
        assertThat(run("!results.missing")).isTrue();
    }

    @Test
    void runtimeErrorFailsClosed() {
        ConditionResult result = evaluator.evaluate("results.missing.success", context);

        assertThat(result.shouldExecute()).isFalse();
        assertThat(result.failed()).isTrue();
        assertThat(result.error()).isEqualTo("Cannot read properties of undefined (reading 'success')");
    }

    @Test
    void syntaxErrorFailsClosed() {
        ConditionResult result = evaluator.evaluate("results.analyze.success &&", context);

        assertThat(result.shouldExecute()).isFalse();
        assertThat(result.error()).contains("Unexpected end of expression");
    }

    @Test
    void unknownIdentifiersAndGlobalsAreUnreachable() {
        assertThat(evaluator.evaluate("process.exit(1)", context).error()).isEqualTo("process is not defined");
        assertThat(evaluator.evaluate("System", context).shouldExecute()).isFalse();
        assertThat(evaluator.evaluate("x = 1", context).error()).contains("Assignment is not allowed");
        assertThat(evaluator.evaluate("eval('1')", context).error()).contains("Only method calls are allowed");
    }

    @Test
    void callingNonMethodsIsAnError() {
        ConditionResult result = evaluator.evaluate("results.analyze.content.launch()", context);

        assertThat(result.shouldExecute()).isFalse();
        assertThat(result.error()).isEqualTo("'launch' is not a function");
    }

    @Test
    void validateConditionReportsOnlySyntaxErrors() {
        assertThat(evaluator.validateCondition("results.a.success").valid()).isTrue();
        assertThat(evaluator.validateCondition("results.nothing.deeper.still").valid()).isTrue();
        assertThat(evaluator.validateCondition(null).valid()).isTrue();

        var invalid = evaluator.validateCondition("results.a.success )");
        assertThat(invalid.valid()).isFalse();
        assertThat(invalid.error()).contains("Unexpected token ')'");
    }

    @Test
    void stepConditionUsesResultsSoFar() {
        var step = new StepDefinition("fix", "Fix", "fixer", List.of("lint"), null,
            "!results.lint.success", null, null, null);

        ConditionResult result = evaluator.evaluateStepCondition(step, results(),
            FlowRequest.of("x"), new FlowDefinition("f", "F", null, null, List.of(step), null, null));

        assertThat(result.shouldExecute()).isTrue();
        assertThat(result.condition()).isEqualTo("!results.lint.success");
    }

    private boolean run(String condition) {
        ConditionResult result = evaluator.evaluate(condition, context);
        assertThat(result.error()).as("error evaluating %s", condition).isNull();
        return result.shouldExecute();
    }

    private static Map<String, StepResult> results() {
        Instant now = Instant.now();
        var results = new LinkedHashMap<String, StepResult>();
        results.put("analyze", StepResult.succeeded("analyze", AgentResult.of("Overall LGTM"), now, now));
        results.put("lint", StepResult.failed("lint", "linter crashed", now, now));
        results.put("docs", StepResult.skipped("docs", "not needed", now, now));
        results.put("scan", StepResult.succeeded("scan", AgentResult.of("""
            {"severity": "high", "tags": ["sql", "xss"], "findings": [{"score": 9.5}, {"score": 4}]}
            """), now, now));
        return results;
    }
}
