package dev.flows.condition;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything a condition can see: prior step results, the original request and flow metadata.
 * Nothing else is reachable from an expression.
 */
public record ConditionContext(Map<String, StepView> results, RequestView request, FlowView flow) {

    public ConditionContext {
        results = results == null ? Map.of() : Map.copyOf(results);
    }

    Map<String, Object> bindings() {
        var bindings = new HashMap<String, Object>(4);
        bindings.put("results", results);
        bindings.put("request", request);
        bindings.put("flow", flow);
        return bindings;
    }

    /**
     * A prior step's result as seen by conditions. {@code data} is the parsed JSON form of
     * {@code content} and is only present when {@code hasData} is set.
     */
    public record StepView(
        boolean success,
        boolean skipped,
        String content,
        boolean hasData,
        Object data,
        long durationMs,
        String error
    ) implements ScriptObject {

        @Override
        public Object property(String name) {
            return switch (name) {
                case "success" -> success;
                case "skipped" -> skipped ? Boolean.TRUE : Values.UNDEFINED;
                case "content" -> orUndefined(content);
                case "data" -> hasData ? Values.normalize(data) : Values.UNDEFINED;
                case "duration" -> (double) durationMs;
                case "error" -> orUndefined(error);
                default -> Values.UNDEFINED;
            };
        }
    }

    public record RequestView(String userPrompt, String traceId, String requestId) implements ScriptObject {

        @Override
        public Object property(String name) {
            return switch (name) {
                case "userPrompt" -> orUndefined(userPrompt);
                case "traceId" -> orUndefined(traceId);
                case "requestId" -> orUndefined(requestId);
                default -> Values.UNDEFINED;
            };
        }
    }

    public record FlowView(String id, String name, String version) implements ScriptObject {

        @Override
        public Object property(String property) {
            return switch (property) {
                case "id" -> orUndefined(id);
                case "name" -> orUndefined(name);
                case "version" -> orUndefined(version);
                default -> Values.UNDEFINED;
            };
        }
    }

    private static Object orUndefined(Object value) {
        return value == null ? Values.UNDEFINED : value;
    }
}
