package dev.flows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flows.model.FlowOutput;
import dev.flows.model.StepResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the run's output text from the contents of the steps named in {@code output.from}.
 */
public final class OutputAggregator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OutputAggregator() {}

    public static String aggregate(FlowOutput output, Map<String, StepResult> results) {
        List<String> from = output.from();
        if (from.isEmpty()) {
            return "";
        }
        if (from.size() == 1) {
            return contentOf(from.get(0), results);
        }

        return switch (output.format()) {
            case CONCAT -> from.stream()
                .map(id -> contentOf(id, results))
                .filter(content -> !content.isEmpty())
                .collect(Collectors.joining("\n"));
            case JSON -> toJson(from, results);
            case MARKDOWN -> from.stream()
                .map(id -> "## " + id + "\n\n" + contentOf(id, results))
                .collect(Collectors.joining("\n\n"));
        };
    }

    private static String toJson(List<String> from, Map<String, StepResult> results) {
        ObjectNode root = MAPPER.createObjectNode();
        for (String id : from) {
            String content = contentOf(id, results);
            if (!content.isEmpty()) {
                root.put(id, content);
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow output", e);
        }
    }

    private static String contentOf(String stepId, Map<String, StepResult> results) {
        StepResult result = results.get(stepId);
        return result == null ? "" : Objects.requireNonNullElse(result.content(), "");
    }
}
