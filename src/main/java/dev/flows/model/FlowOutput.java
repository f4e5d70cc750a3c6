package dev.flows.model;

import java.util.List;

/**
 * Which step results form the flow's final output, and how they are combined.
 */
public record FlowOutput(List<String> from, OutputFormat format) {

    public FlowOutput {
        from = from == null ? List.of() : List.copyOf(from);
        format = format == null ? OutputFormat.MARKDOWN : format;
    }

    public static FlowOutput of(String stepId) {
        return new FlowOutput(List.of(stepId), OutputFormat.MARKDOWN);
    }
}
