package dev.flows.cli;

import dev.flows.engine.FlowLoader;
import dev.flows.model.FlowDefinition;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List the flows defined in a directory.")
class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--dir", defaultValue = "flows", description = "Directory of *.json flow files (default: ${DEFAULT-VALUE})")
    private Path dir;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        Map<String, FlowDefinition> flows = FlowLoader.loadFromDirectory(dir);
        if (flows.isEmpty()) {
            out.println("No flows found in " + dir);
            return FlowsCli.EXIT_OK;
        }
        out.println("Available flows:");
        for (FlowDefinition flow : flows.values()) {
            out.printf("  %-24s %-32s v%-8s %d step(s)%n",
                flow.id(), flow.name() == null ? "" : flow.name(), flow.version(), flow.steps().size());
        }
        return FlowsCli.EXIT_OK;
    }
}
