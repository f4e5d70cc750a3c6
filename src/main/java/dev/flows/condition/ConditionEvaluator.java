package dev.flows.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flows.model.FlowDefinition;
import dev.flows.model.FlowRequest;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepResult;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether a step runs, from a boolean expression over {@code results}, {@code request}
 * and {@code flow}. Evaluation fails closed: a condition that does not parse or that errors at
 * runtime yields {@code shouldExecute == false} with the error captured, and never throws.
 */
public final class ConditionEvaluator {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Evaluate a condition expression against a context.
     *
     * @param condition expression text; blank means "always run"
     * @param context   the only state the expression can reach
     */
    public ConditionResult evaluate(String condition, ConditionContext context) {
        long start = System.nanoTime();

        if (condition == null || condition.isBlank()) {
            return new ConditionResult(true, condition == null ? "" : condition, null, elapsedSince(start));
        }

        try {
            Expr expr = Parser.parse(condition);
            Object value = expr.evaluate(new Scope(context.bindings()));
            return new ConditionResult(Values.truthy(value), condition, null, elapsedSince(start));
        } catch (ConditionException e) {
            return new ConditionResult(false, condition, e.getMessage(), elapsedSince(start));
        } catch (RuntimeException e) {
            return new ConditionResult(false, condition, e.toString(), elapsedSince(start));
        } catch (StackOverflowError e) {
            return new ConditionResult(false, condition, "Condition is nested too deeply", elapsedSince(start));
        }
    }

    /**
     * Evaluate a step's condition against the results gathered so far.
     */
    public ConditionResult evaluateStepCondition(StepDefinition step,
                                                 Map<String, StepResult> stepResults,
                                                 FlowRequest request,
                                                 FlowDefinition flow) {
        if (!step.hasCondition()) {
            return new ConditionResult(true, "", null, Duration.ZERO);
        }
        return evaluate(step.condition(), buildContext(stepResults, request, flow));
    }

    /**
     * Build the evaluation context from step results.
     */
    public ConditionContext buildContext(Map<String, StepResult> stepResults, FlowRequest request, FlowDefinition flow) {
        var results = new LinkedHashMap<String, ConditionContext.StepView>();
        for (var entry : stepResults.entrySet()) {
            StepResult result = entry.getValue();
            String content = result.content();
            ParsedJson parsed = tryParseJson(content);
            results.put(entry.getKey(), new ConditionContext.StepView(
                result.success(),
                result.skipped(),
                content,
                parsed.present(),
                parsed.value(),
                result.duration() == null ? 0 : result.duration().toMillis(),
                result.error()
            ));
        }
        return new ConditionContext(
            results,
            new ConditionContext.RequestView(request.userPrompt(), request.traceId(), request.requestId()),
            new ConditionContext.FlowView(flow.id(), flow.name(), flow.version())
        );
    }

    /**
     * Check a condition for syntax errors without a real run. Only parse errors make a
     * condition invalid; runtime errors depend on the results of a particular run.
     */
    public ConditionValidation validateCondition(String condition) {
        if (condition == null || condition.isBlank()) {
            return ConditionValidation.ok();
        }
        try {
            Parser.parse(condition);
            return ConditionValidation.ok();
        } catch (ConditionSyntaxException e) {
            return new ConditionValidation(false, e.getMessage());
        }
    }

    private static ParsedJson tryParseJson(String content) {
        if (content == null || content.isBlank()) {
            return ParsedJson.ABSENT;
        }
        try {
            return new ParsedJson(true, MAPPER.readValue(content, Object.class));
        } catch (JsonProcessingException e) {
            return ParsedJson.ABSENT;
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record ParsedJson(boolean present, Object value) {
        static final ParsedJson ABSENT = new ParsedJson(false, null);
    }

    /**
     * Result of {@link #validateCondition(String)}.
     */
    public record ConditionValidation(boolean valid, String error) {
        static ConditionValidation ok() {
            return new ConditionValidation(true, null);
        }
    }
}
