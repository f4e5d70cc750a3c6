package dev.flows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Built-in transforms applied to a step's input before the agent sees it. Each one throws
 * {@link IllegalArgumentException} when its input or arguments do not fit.
 */
public final class Transforms {

    public static final String PASSTHROUGH = "passthrough";
    public static final String MERGE_AS_CONTEXT = "mergeAsContext";
    public static final String EXTRACT_SECTION = "extractSection";
    public static final String APPEND_TO_REQUEST = "appendToRequest";
    public static final String JSON_EXTRACT = "jsonExtract";
    public static final String TEMPLATE_FILL = "templateFill";

    public static final Set<String> BUILT_IN = Set.of(
        PASSTHROUGH, MERGE_AS_CONTEXT, EXTRACT_SECTION, APPEND_TO_REQUEST, JSON_EXTRACT, TEMPLATE_FILL);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private Transforms() {}

    public static String passthrough(String input) {
        return input;
    }

    /**
     * Render each input as a numbered markdown section: {@code ## Step 1}, {@code ## Step 2}, ...
     */
    public static String mergeAsContext(List<String> inputs) {
        return IntStream.range(0, inputs.size())
            .mapToObj(i -> "## Step " + (i + 1) + "\n" + inputs.get(i))
            .collect(Collectors.joining("\n\n"));
    }

    /**
     * Body of the first {@code ## } heading containing {@code sectionName}, up to the next
     * {@code ## } heading. Leading and trailing blank lines are dropped.
     */
    public static String extractSection(String input, String sectionName) {
        boolean inSection = false;
        List<String> body = new ArrayList<>();
        for (String line : input.split("\n", -1)) {
            if (!inSection) {
                inSection = line.startsWith("## ") && line.contains(sectionName);
                continue;
            }
            if (line.startsWith("## ")) {
                break;
            }
            body.add(line);
        }
        if (!inSection) {
            throw new IllegalArgumentException("Section '" + sectionName + "' not found");
        }

        int from = 0;
        int to = body.size();
        while (from < to && body.get(from).isBlank()) {
            from++;
        }
        while (to > from && body.get(to - 1).isBlank()) {
            to--;
        }
        return String.join("\n", body.subList(from, to));
    }

    public static String appendToRequest(String request, String stepOutput) {
        String requestPart = request == null || request.isEmpty() ? "Original:" : "Original: " + request;
        String outputPart = stepOutput == null || stepOutput.isEmpty() ? "Step Output:" : "Step Output: " + stepOutput;
        return requestPart + "\n\n" + outputPart;
    }

    /**
     * Follow a dot path ({@code user.profile.age}, {@code items.0.name}) into JSON input.
     * Text values come back raw; any other value is rendered as JSON.
     */
    public static String jsonExtract(String input, String fieldPath) {
        JsonNode current;
        try {
            current = MAPPER.readTree(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON input: " + e.getOriginalMessage(), e);
        }
        if (current == null || current.isMissingNode()) {
            throw new IllegalArgumentException("Invalid JSON input: empty document");
        }

        for (String segment : fieldPath.split("\\.")) {
            if (current.isArray() && segment.matches("\\d+")) {
                int index = Integer.parseInt(segment);
                if (index >= current.size()) {
                    throw fieldNotFound(fieldPath);
                }
                current = current.get(index);
            } else if (current.isObject() && current.has(segment)) {
                current = current.get(segment);
            } else {
                throw fieldNotFound(fieldPath);
            }
        }
        return current.isTextual() ? current.asText() : current.toString();
    }

    /**
     * Replace every {@code {{name}}} placeholder with its value from {@code context}.
     */
    public static String templateFill(String template, Map<String, String> context) {
        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            variables.add(matcher.group(1));
        }

        String result = template;
        for (String variable : variables) {
            if (!context.containsKey(variable)) {
                throw new IllegalArgumentException("Missing context variable: " + variable);
            }
            result = result.replace("{{" + variable + "}}", String.valueOf(context.get(variable)));
        }
        return result;
    }

    private static IllegalArgumentException fieldNotFound(String fieldPath) {
        return new IllegalArgumentException("Field '" + fieldPath + "' not found");
    }
}
