package dev.flows.cli;

import dev.flows.engine.FlowLoader;
import dev.flows.engine.FlowValidator;
import dev.flows.model.FlowDefinition;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Check a flow definition for errors.")
class ValidateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Flow definition file")
    private Path file;

    @Override
    public Integer call() throws IOException {
        FlowDefinition flow;
        try {
            flow = FlowLoader.loadFromFile(file);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid: " + e.getMessage());
            return FlowsCli.EXIT_FATAL;
        }

        List<String> errors = FlowValidator.validate(flow);
        FlowValidator.warnings(flow).forEach(warning -> spec.commandLine().getErr().println("Warning: " + warning));
        if (errors.isEmpty()) {
            spec.commandLine().getOut().println("Flow '" + flow.id() + "' is valid");
            return FlowsCli.EXIT_OK;
        }
        spec.commandLine().getErr().println("Flow '" + flow.id() + "' is invalid:");
        errors.forEach(error -> spec.commandLine().getErr().println("  - " + error));
        return FlowsCli.EXIT_FATAL;
    }
}
