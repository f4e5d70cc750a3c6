package dev.flows.model;

import java.util.List;
import java.util.Optional;

/**
 * A flow is a declarative DAG of steps that share output and settings configuration.
 */
public record FlowDefinition(
    String id,
    String name,
    String description,
    String version,
    List<StepDefinition> steps,
    FlowOutput output,
    FlowSettings settings
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public FlowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
        version = version == null ? DEFAULT_VERSION : version;
        output = output == null ? new FlowOutput(List.of(), null) : output;
        settings = settings == null ? FlowSettings.defaults() : settings;
    }

    public FlowDefinition withSettings(FlowSettings settings) {
        return new FlowDefinition(id, name, description, version, steps, output, settings);
    }

    public Optional<StepDefinition> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }
}
