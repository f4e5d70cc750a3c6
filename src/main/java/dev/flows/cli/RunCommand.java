package dev.flows.cli;

import ch.qos.logback.classic.Level;
import dev.flows.backend.AgentExecutor;
import dev.flows.backend.BackendConfig;
import dev.flows.backend.BackendResolver;
import dev.flows.engine.FlowExecutionException;
import dev.flows.engine.FlowLoader;
import dev.flows.engine.FlowRun;
import dev.flows.engine.FlowRunner;
import dev.flows.engine.FlowValidationException;
import dev.flows.engine.FlowValidator;
import dev.flows.engine.Slf4jFlowEventLogger;
import dev.flows.gate.GateEvaluator;
import dev.flows.gate.JudgeEvaluator;
import dev.flows.model.FlowDefinition;
import dev.flows.model.FlowRequest;
import dev.flows.model.FlowSettings;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(name = "run", description = "Run a flow and print its output.")
class RunCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private FlowsCli parent;

    @Parameters(index = "0", description = "Flow definition file")
    private Path file;

    @Option(names = {"-p", "--prompt"}, description = "User prompt the flow runs for")
    private String prompt;

    @Option(names = "--prompt-file", description = "Read the user prompt from a file")
    private Path promptFile;

    @Option(names = "--backend", description = "Agent backend: echo, command (overrides environment and config file)")
    private String backend;

    @Option(names = "--command", description = "Agent command line for the command backend; {agent} is replaced by the agent id")
    private String command;

    @Option(names = "--config", description = "Properties file with backend settings")
    private Path config;

    @Option(names = "--working-dir", description = "Working directory for agent processes (default: current directory)")
    private Path workingDir;

    @Option(names = "--trace-id", description = "Trace id attached to every event")
    private String traceId;

    @Option(names = "--request-id", description = "Request id attached to every event")
    private String requestId;

    @Option(names = "--max-parallelism", description = "Override settings.maxParallelism")
    private Integer maxParallelism;

    @Option(names = "--fail-fast", negatable = true, description = "Override settings.failFast")
    private Boolean failFast;

    @Option(names = "--verbose", description = "Log engine details at DEBUG")
    private boolean verbose;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            enableDebugLogging();
        }

        String userPrompt = readPrompt();
        if (userPrompt == null) {
            err.println("Error: a prompt is required (--prompt or --prompt-file)");
            return FlowsCli.EXIT_FATAL;
        }

        FlowDefinition flow = applyOverrides(FlowLoader.loadFromFile(file));
        List<String> errors = FlowValidator.validate(flow);
        if (!errors.isEmpty()) {
            err.println("Error: flow '" + flow.id() + "' is invalid:");
            errors.forEach(e -> err.println("  - " + e));
            return FlowsCli.EXIT_FATAL;
        }

        BackendConfig backendConfig;
        try {
            backendConfig = BackendResolver.resolve(backendEnv(), loadConfig(), workingDir);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return FlowsCli.EXIT_FATAL;
        }

        ExecutorService processes = Executors.newCachedThreadPool();
        try {
            AgentExecutor executor = BackendResolver.create(backendConfig, processes);
            var runner = new FlowRunner(executor, new Slf4jFlowEventLogger(),
                new GateEvaluator(new JudgeEvaluator(executor)), null);

            FlowRun run = runner.execute(flow, new FlowRequest(userPrompt, traceId, requestId));
            out.println(run.output());
            out.flush();
            StepSummary.print(err, run.stepResults());
            return run.success() ? FlowsCli.EXIT_OK : FlowsCli.EXIT_STEPS_FAILED;
        } catch (FlowExecutionException e) {
            err.println("Error: " + e.getMessage());
            StepSummary.print(err, e.partialResults());
            return FlowsCli.EXIT_FATAL;
        } catch (FlowValidationException e) {
            err.println("Error: " + e.getMessage());
            return FlowsCli.EXIT_FATAL;
        } finally {
            processes.shutdownNow();
        }
    }

    private String readPrompt() throws IOException {
        if (prompt != null) {
            return prompt;
        }
        return promptFile == null ? null : Files.readString(promptFile);
    }

    private FlowDefinition applyOverrides(FlowDefinition flow) {
        FlowSettings settings = flow.settings();
        if (maxParallelism != null) {
            settings = settings.withMaxParallelism(maxParallelism);
        }
        if (failFast != null) {
            settings = settings.withFailFast(failFast);
        }
        return flow.withSettings(settings);
    }

    /** Command-line flags take precedence over the environment. */
    private Map<String, String> backendEnv() {
        Map<String, String> env = new HashMap<>(parent.env());
        if (backend != null) {
            env.put(BackendResolver.ENV_BACKEND, backend);
        }
        if (command != null) {
            env.put(BackendResolver.ENV_COMMAND, command);
        }
        return env;
    }

    private Properties loadConfig() throws IOException {
        var properties = new Properties();
        if (config != null) {
            try (Reader reader = Files.newBufferedReader(config)) {
                properties.load(reader);
            }
        }
        return properties;
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger("dev.flows") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
