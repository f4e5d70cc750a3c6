package dev.flows.cli;

import dev.flows.engine.FlowLoader;
import dev.flows.model.FlowDefinition;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepKind;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "show", description = "Show a flow's metadata, dependency graph and steps.")
class ShowCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Flow definition file")
    private Path file;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        FlowDefinition flow = FlowLoader.loadFromFile(file);

        out.printf("Flow: %s (%s) v%s%n", flow.id(), flow.name(), flow.version());
        if (flow.description() != null) {
            out.println("  " + flow.description());
        }
        out.printf("Settings: maxParallelism=%d, failFast=%s%n",
            flow.settings().maxParallelism(), flow.settings().failFast());
        out.printf("Output: %s as %s%n", flow.output().from(), flow.output().format().value());

        out.println();
        out.println("Steps:");
        for (StepDefinition step : flow.steps()) {
            out.printf("  %s [%s] agent=%s input=%s transform=%s%n", step.id(), step.type().value(), step.agent(),
                step.input().source().value(), step.input().transform().displayName());
            if (!step.dependsOn().isEmpty()) {
                out.println("    depends on: " + String.join(", ", step.dependsOn()));
            }
            if (step.hasCondition()) {
                out.println("    condition: " + step.condition());
            }
            if (step.kind() instanceof StepKind.Gate gate) {
                out.printf("    gate: judge=%s criteria=%s threshold=%s onFail=%s%n", gate.evaluate().agent(),
                    gate.evaluate().criteria(), gate.evaluate().threshold(), gate.evaluate().onFail().value());
            }
        }

        out.println();
        out.println("Dependency graph:");
        for (StepDefinition step : flow.steps()) {
            for (String dependency : step.dependsOn()) {
                out.printf("  %s -> %s%n", dependency, step.id());
            }
        }
        return FlowsCli.EXIT_OK;
    }
}
