package dev.flows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flows.model.FlowRequest;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepInput;
import dev.flows.model.StepResult;
import dev.flows.model.TransformSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the text a step receives: reads it from the request or from upstream results, then
 * applies the step's transform. Any problem is a {@link StepInputException} for that step;
 * unknown transforms are never treated as passthrough.
 */
public final class TransformPipeline {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Resolve and transform the input of {@code step}.
     */
    public PreparedInput prepare(StepDefinition step, FlowRequest request, Map<String, StepResult> results) {
        ResolvedInput resolved = resolve(step, request, results);
        StepInput input = step.input();

        long start = System.nanoTime();
        String prompt = applyTransform(resolved, input.transform(), input.transformArgs(), request.userPrompt());
        Duration transformDuration = Duration.ofNanos(System.nanoTime() - start);

        return new PreparedInput(resolved.text(), prompt, input.transform().displayName(), transformDuration);
    }

    /**
     * Read the raw input for {@code step} according to its input source.
     */
    public ResolvedInput resolve(StepDefinition step, FlowRequest request, Map<String, StepResult> results) {
        StepInput input = step.input();
        switch (input.source()) {
            case REQUEST -> {
                return ResolvedInput.of(request.userPrompt());
            }
            case STEP -> {
                if (input.stepId() == null || input.stepId().isBlank()) {
                    throw new StepInputException("Step '%s' has source 'step' but no stepId".formatted(step.id()));
                }
                return ResolvedInput.of(upstreamContent(step.id(), input.stepId(), results));
            }
            case AGGREGATE -> {
                if (input.from().isEmpty()) {
                    throw new StepInputException(
                        "Step '%s' has source 'aggregate' but no 'from' steps".formatted(step.id()));
                }
                List<String> parts = new ArrayList<>();
                for (String sourceId : input.from()) {
                    parts.add(upstreamContent(step.id(), sourceId, results));
                }
                String text = parts.size() == 1 ? parts.get(0) : String.join("\n\n", parts);
                return new ResolvedInput(text, List.copyOf(parts));
            }
            case FEEDBACK -> throw new StepInputException(
                "Step '%s' uses input source 'feedback', which flow runs do not provide".formatted(step.id()));
            default -> throw new StepInputException("Invalid input source: " + input.source().value());
        }
    }

    /**
     * Apply a transform to resolved input.
     *
     * @param originalPrompt the run's user prompt, used by {@code appendToRequest}
     */
    public String applyTransform(ResolvedInput input, TransformSpec transform, JsonNode args, String originalPrompt) {
        if (transform instanceof TransformSpec.Custom custom) {
            try {
                return custom.function().apply(input.text());
            } catch (Exception e) {
                throw new StepInputException("Custom transform failed: " + e.getMessage(), e);
            }
        }

        String name = ((TransformSpec.Named) transform).name();
        try {
            return switch (name) {
                case Transforms.PASSTHROUGH -> Transforms.passthrough(input.text());
                case Transforms.MERGE_AS_CONTEXT -> Transforms.mergeAsContext(mergeInputs(input, args));
                case Transforms.EXTRACT_SECTION -> Transforms.extractSection(input.text(),
                    textArg(args, "extractSection requires a section name as transformArgs"));
                case Transforms.APPEND_TO_REQUEST -> Transforms.appendToRequest(originalPrompt, input.text());
                case Transforms.JSON_EXTRACT -> Transforms.jsonExtract(input.text(),
                    textArg(args, "jsonExtract requires a field path as transformArgs"));
                case Transforms.TEMPLATE_FILL -> Transforms.templateFill(input.text(), contextArg(args));
                default -> throw new StepInputException("Unknown transform: " + name);
            };
        } catch (IllegalArgumentException e) {
            throw new StepInputException(e.getMessage(), e);
        }
    }

    private static String upstreamContent(String stepId, String sourceId, Map<String, StepResult> results) {
        StepResult result = results.get(sourceId);
        if (result == null || !result.hasContent()) {
            throw new StepInputException(
                "Missing upstream result: step '%s' depends on '%s' which has no result".formatted(stepId, sourceId));
        }
        return result.content();
    }

    private static List<String> mergeInputs(ResolvedInput input, JsonNode args) {
        if (args != null && args.isArray()) {
            List<String> sections = new ArrayList<>();
            args.forEach(node -> sections.add(node.isTextual() ? node.asText() : node.toString()));
            return sections;
        }
        if (!input.parts().isEmpty()) {
            return input.parts();
        }

        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(input.text());
        } catch (JsonProcessingException e) {
            parsed = null;
        }
        if (parsed == null || parsed.isMissingNode()) {
            return Arrays.stream(input.text().split("\n\n"))
                .filter(s -> !s.isBlank())
                .toList();
        }
        if (!parsed.isArray()) {
            throw new IllegalArgumentException("mergeAsContext requires an array of strings");
        }
        List<String> sections = new ArrayList<>();
        parsed.forEach(node -> sections.add(node.isTextual() ? node.asText() : node.toString()));
        return sections;
    }

    private static String textArg(JsonNode args, String message) {
        if (args == null || !args.isTextual()) {
            throw new IllegalArgumentException(message);
        }
        return args.asText();
    }

    private static Map<String, String> contextArg(JsonNode args) {
        if (args == null || !args.isObject()) {
            throw new IllegalArgumentException("templateFill requires a context object as transformArgs");
        }
        var context = new LinkedHashMap<String, String>();
        for (var entry : args.properties()) {
            JsonNode value = entry.getValue();
            context.put(entry.getKey(), value.isTextual() ? value.asText() : value.toString());
        }
        return context;
    }

    /**
     * Raw step input. {@code parts} holds the individual upstream contents of an aggregate
     * source and is empty for the other sources.
     */
    public record ResolvedInput(String text, List<String> parts) {
        public static ResolvedInput of(String text) {
            return new ResolvedInput(text, List.of());
        }
    }

    /**
     * Input ready for the agent, with what the runner reports about the transform.
     */
    public record PreparedInput(String rawInput, String prompt, String transformName, Duration transformDuration) {
    }
}
