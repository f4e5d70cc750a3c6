package dev.flows.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Where a step's input text comes from and how it is reshaped before the agent sees it.
 */
public record StepInput(
    InputSource source,
    String stepId,        // nullable: required for STEP
    List<String> from,    // required for AGGREGATE
    TransformSpec transform,
    JsonNode transformArgs // nullable
) {
    public StepInput {
        source = source == null ? InputSource.REQUEST : source;
        from = from == null ? List.of() : List.copyOf(from);
        transform = transform == null ? TransformSpec.PASSTHROUGH : transform;
    }

    public static StepInput fromRequest() {
        return new StepInput(InputSource.REQUEST, null, null, TransformSpec.PASSTHROUGH, null);
    }

    public static StepInput fromStep(String stepId) {
        return new StepInput(InputSource.STEP, stepId, null, TransformSpec.PASSTHROUGH, null);
    }

    public static StepInput aggregate(List<String> from) {
        return new StepInput(InputSource.AGGREGATE, null, from, TransformSpec.PASSTHROUGH, null);
    }

    public StepInput withTransform(TransformSpec spec, JsonNode args) {
        return new StepInput(source, stepId, from, spec, args);
    }
}
