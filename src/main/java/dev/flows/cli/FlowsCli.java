package dev.flows.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for agent-flows.
 */
@Command(
    name = "agent-flows",
    mixinStandardHelpOptions = true,
    version = "agent-flows 0.1.0",
    description = "Run multi-agent flows: dependency waves, step conditions, input transforms and quality gates.",
    subcommands = {
        ListCommand.class,
        ShowCommand.class,
        PlanCommand.class,
        ValidateCommand.class,
        RunCommand.class
    }
)
public class FlowsCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_STEPS_FAILED = 2;

    private final Map<String, String> env;

    @Spec
    private CommandSpec spec;

    public FlowsCli() {
        this(System.getenv());
    }

    public FlowsCli(Map<String, String> env) {
        this.env = Map.copyOf(env);
    }

    /**
     * Command line with the error handling used by {@code main}: failures print one
     * {@code Error:} line instead of a stack trace.
     */
    public static CommandLine commandLine(Map<String, String> env) {
        return new CommandLine(new FlowsCli(env))
            .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                cmd.getErr().println("Error: " + e.getMessage());
                return EXIT_FATAL;
            });
    }

    Map<String, String> env() {
        return env;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }
}
