package dev.flows.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flows.model.FlowDefinition;
import dev.flows.model.FlowOutput;
import dev.flows.model.FlowSettings;
import dev.flows.model.GateConfig;
import dev.flows.model.InputSource;
import dev.flows.model.OutputFormat;
import dev.flows.model.RetryPolicy;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepInput;
import dev.flows.model.StepKind;
import dev.flows.model.StepType;
import dev.flows.model.TransformSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads flow definitions from JSON files and applies defaults for omitted fields.
 *
 * <p>Unreadable files raise {@link IOException}; structurally malformed definitions (missing
 * required fields, unknown enum values, a gate without {@code evaluate}) raise
 * {@link IllegalArgumentException}. Graph and reference checks are left to
 * {@link FlowValidator}.
 */
public final class FlowLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowLoader() {}

    /**
     * Load a single flow from a JSON file.
     */
    public static FlowDefinition loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        try {
            return parseFlow(root);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a single flow from a JSON string.
     */
    public static FlowDefinition loadFromString(String json) throws IOException {
        return parseFlow(MAPPER.readTree(json));
    }

    /**
     * Load all flows from the {@code *.json} files of a directory, keyed by flow id.
     */
    public static Map<String, FlowDefinition> loadFromDirectory(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> entries = Files.list(dir)) {
            files = entries.filter(p -> p.toString().endsWith(".json")).sorted().toList();
        }
        var flows = new LinkedHashMap<String, FlowDefinition>();
        for (Path file : files) {
            FlowDefinition flow = loadFromFile(file);
            if (flows.putIfAbsent(flow.id(), flow) != null) {
                throw new IllegalArgumentException("Duplicate flow id '%s' in %s".formatted(flow.id(), file));
            }
        }
        return flows;
    }

    private static FlowDefinition parseFlow(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Flow definition must be a JSON object");
        }
        String id = requiredText(root, "id", "flow");
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalArgumentException("Flow '%s' is missing its 'steps' array".formatted(id));
        }

        List<StepDefinition> steps = new ArrayList<>();
        for (JsonNode stepNode : stepsNode) {
            steps.add(parseStep(stepNode));
        }

        return new FlowDefinition(
            id,
            text(root, "name"),
            text(root, "description"),
            text(root, "version"),
            steps,
            parseOutput(root.get("output")),
            parseSettings(root.get("settings"))
        );
    }

    private static FlowOutput parseOutput(JsonNode node) {
        if (node == null) {
            return null;
        }
        List<String> from = new ArrayList<>();
        JsonNode fromNode = node.get("from");
        if (fromNode != null && fromNode.isArray()) {
            fromNode.forEach(f -> from.add(f.asText()));
        } else if (fromNode != null && fromNode.isTextual()) {
            from.add(fromNode.asText());
        }
        OutputFormat format = node.has("format") ? OutputFormat.fromValue(node.get("format").asText()) : null;
        return new FlowOutput(from, format);
    }

    private static FlowSettings parseSettings(JsonNode node) {
        if (node == null) {
            return FlowSettings.defaults();
        }
        int maxParallelism = node.has("maxParallelism")
            ? node.get("maxParallelism").asInt() : FlowSettings.DEFAULT_MAX_PARALLELISM;
        boolean failFast = node.has("failFast")
            ? node.get("failFast").asBoolean() : FlowSettings.DEFAULT_FAIL_FAST;
        Long timeout = node.has("timeout") ? node.get("timeout").asLong() : null;
        return new FlowSettings(maxParallelism, failFast, timeout);
    }

    private static StepDefinition parseStep(JsonNode node) {
        String id = requiredText(node, "id", "step");
        String agent = requiredText(node, "agent", "step '" + id + "'");
        StepType type = node.has("type") ? StepType.fromValue(node.get("type").asText()) : StepType.AGENT;

        List<String> dependsOn = new ArrayList<>();
        if (node.has("dependsOn")) {
            node.get("dependsOn").forEach(d -> dependsOn.add(d.asText()));
        }

        return new StepDefinition(
            id,
            text(node, "name"),
            agent,
            dependsOn,
            parseInput(node.get("input")),
            text(node, "condition"),
            node.has("timeout") ? node.get("timeout").asLong() : null,
            parseRetry(node.get("retry")),
            parseKind(id, type, node)
        );
    }

    private static StepInput parseInput(JsonNode node) {
        if (node == null) {
            return StepInput.fromRequest();
        }
        InputSource source = node.has("source") ? InputSource.fromValue(node.get("source").asText()) : InputSource.REQUEST;
        List<String> from = new ArrayList<>();
        if (node.has("from")) {
            node.get("from").forEach(f -> from.add(f.asText()));
        }
        TransformSpec transform = node.has("transform")
            ? TransformSpec.named(node.get("transform").asText()) : TransformSpec.PASSTHROUGH;
        JsonNode args = node.get("transformArgs");
        return new StepInput(source, text(node, "stepId"), from, transform, args == null || args.isNull() ? null : args);
    }

    private static RetryPolicy parseRetry(JsonNode node) {
        if (node == null) {
            return RetryPolicy.defaults();
        }
        int maxAttempts = node.has("maxAttempts")
            ? node.get("maxAttempts").asInt() : RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        long backoffMs = node.has("backoffMs")
            ? node.get("backoffMs").asLong() : RetryPolicy.DEFAULT_BACKOFF_MS;
        return new RetryPolicy(maxAttempts, backoffMs);
    }

    private static StepKind parseKind(String stepId, StepType type, JsonNode node) {
        return switch (type) {
            case AGENT -> new StepKind.Agent();
            case GATE -> {
                if (!node.has("evaluate")) {
                    throw new IllegalArgumentException(
                        "Step '%s' has type 'gate' but no 'evaluate' block".formatted(stepId));
                }
                yield new StepKind.Gate(parseGate(stepId, node.get("evaluate")), parseLoop(node.get("loop")));
            }
            case BRANCH -> {
                List<StepKind.BranchCondition> branches = new ArrayList<>();
                if (node.has("branches")) {
                    for (JsonNode branch : node.get("branches")) {
                        branches.add(new StepKind.BranchCondition(
                            requiredText(branch, "condition", "branch of step '" + stepId + "'"),
                            requiredText(branch, "goto", "branch of step '" + stepId + "'")));
                    }
                }
                yield new StepKind.Branch(branches, text(node, "default"));
            }
            case CONSENSUS -> parseConsensus(node.get("consensus"));
        };
    }

    private static GateConfig parseGate(String stepId, JsonNode node) {
        String agent = requiredText(node, "agent", "gate of step '" + stepId + "'");
        List<String> criteria = new ArrayList<>();
        if (node.has("criteria")) {
            node.get("criteria").forEach(c -> criteria.add(c.asText()));
        }
        double threshold = node.has("threshold")
            ? node.get("threshold").asDouble() : GateConfig.DEFAULT_THRESHOLD;
        GateConfig.OnFail onFail = node.has("onFail")
            ? GateConfig.OnFail.fromValue(node.get("onFail").asText()) : GateConfig.DEFAULT_ON_FAIL;
        int maxRetries = node.has("maxRetries")
            ? node.get("maxRetries").asInt() : GateConfig.DEFAULT_MAX_RETRIES;
        return new GateConfig(agent, criteria, threshold, onFail, maxRetries);
    }

    private static StepKind.LoopConfig parseLoop(JsonNode node) {
        if (node == null) {
            return null;
        }
        int maxIterations = node.has("maxIterations")
            ? node.get("maxIterations").asInt() : StepKind.LoopConfig.DEFAULT_MAX_ITERATIONS;
        double targetScore = node.has("targetScore")
            ? node.get("targetScore").asDouble() : StepKind.LoopConfig.DEFAULT_TARGET_SCORE;
        return new StepKind.LoopConfig(maxIterations, targetScore, text(node, "backTo"));
    }

    private static StepKind.Consensus parseConsensus(JsonNode node) {
        if (node == null) {
            return new StepKind.Consensus(StepKind.ConsensusMethod.JUDGE, null, null);
        }
        StepKind.ConsensusMethod method = node.has("method")
            ? StepKind.ConsensusMethod.fromValue(node.get("method").asText()) : StepKind.ConsensusMethod.JUDGE;
        Map<String, Double> weights = null;
        if (node.has("weights")) {
            weights = new LinkedHashMap<>();
            for (var entry : node.get("weights").properties()) {
                weights.put(entry.getKey(), entry.getValue().asDouble());
            }
        }
        return new StepKind.Consensus(method, text(node, "judge"), weights);
    }

    private static String requiredText(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Missing required field '%s' in %s".formatted(field, where));
        }
        return value.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
