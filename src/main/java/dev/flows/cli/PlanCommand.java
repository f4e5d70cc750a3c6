package dev.flows.cli;

import dev.flows.engine.DependencyResolver;
import dev.flows.engine.FlowLoader;
import dev.flows.engine.FlowValidationException;
import dev.flows.model.FlowDefinition;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "plan", description = "Print the execution waves of a flow without running it.")
class PlanCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Flow definition file")
    private Path file;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        FlowDefinition flow = FlowLoader.loadFromFile(file);

        List<List<String>> waves;
        try {
            waves = new DependencyResolver(flow.steps()).groupIntoWaves();
        } catch (FlowValidationException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return FlowsCli.EXIT_FATAL;
        }

        out.printf("Execution plan for %s: %d wave(s), max parallelism %d%n",
            flow.id(), waves.size(), flow.settings().maxParallelism());
        for (int i = 0; i < waves.size(); i++) {
            out.printf("  Wave %d: %s%n", i + 1, String.join(", ", waves.get(i)));
        }
        return FlowsCli.EXIT_OK;
    }
}
