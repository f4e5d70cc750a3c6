package dev.flows.cli;

import dev.flows.model.StepResult;

import java.io.PrintWriter;
import java.util.Map;

/**
 * One line per step result: status, duration and the error or skip reason.
 */
final class StepSummary {

    private StepSummary() {}

    static void print(PrintWriter out, Map<String, StepResult> results) {
        out.println("Steps:");
        if (results.isEmpty()) {
            out.println("  (no steps ran)");
        }
        for (StepResult result : results.values()) {
            String status = result.skipped() ? "skipped" : result.success() ? "succeeded" : "failed";
            var line = new StringBuilder();
            line.append("  %-20s %-10s %6dms".formatted(result.stepId(), status, result.duration().toMillis()));
            if (result.skipped() && result.skipReason() != null) {
                line.append("  ").append(result.skipReason());
            } else if (result.error() != null) {
                line.append("  ").append(result.error());
            }
            out.println(line);
        }
        out.flush();
    }
}
